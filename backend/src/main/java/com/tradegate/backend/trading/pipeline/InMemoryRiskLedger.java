package com.tradegate.backend.trading.pipeline;

import com.tradegate.backend.exception.RiskLedgerException;
import com.tradegate.backend.model.PipelineOutcome;
import com.tradegate.backend.model.PositionSide;
import com.tradegate.backend.model.RiskLedgerSnapshot;
import com.tradegate.backend.model.TradeAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local portfolio book. Serves snapshots to the pipeline and books the approved
 * outcomes it is handed, so heat and allocation reflect every prior approval.
 */
@Slf4j
@Component
public class InMemoryRiskLedger implements RiskLedger, DecisionSink {

    private final Map<String, Portfolio> portfolios = new ConcurrentHashMap<>();

    private static final class Position {
        private PositionSide side = PositionSide.FLAT;
        private double allocation;
        private double risk;
    }

    private static final class Portfolio {
        private double equity;
        private double highWaterMark;
        private double heat;
        private final Map<String, Position> positions = new HashMap<>();
        private final Map<String, Double> volatility = new HashMap<>();
    }

    public void openPortfolio(String portfolioId, double equity) {
        Portfolio portfolio = new Portfolio();
        portfolio.equity = equity;
        portfolio.highWaterMark = equity;
        portfolios.put(portfolioId, portfolio);
        log.info("Opened portfolio {} with equity {}", portfolioId, equity);
    }

    public void markToMarket(String portfolioId, double equity) {
        Portfolio portfolio = require(portfolioId);
        synchronized (portfolio) {
            portfolio.equity = equity;
            portfolio.highWaterMark = Math.max(portfolio.highWaterMark, equity);
        }
    }

    public void recordVolatility(String portfolioId, String assetId, double volatility) {
        Portfolio portfolio = require(portfolioId);
        synchronized (portfolio) {
            portfolio.volatility.put(assetId, volatility);
        }
    }

    /**
     * Seeds an existing position, e.g. one opened before this process started.
     */
    public void seedPosition(String portfolioId, String assetId, PositionSide side, double allocation, double risk) {
        Portfolio portfolio = require(portfolioId);
        synchronized (portfolio) {
            Position position = portfolio.positions.computeIfAbsent(assetId, ignored -> new Position());
            portfolio.heat += risk - position.risk;
            position.side = side;
            position.allocation = allocation;
            position.risk = risk;
        }
    }

    @Override
    public RiskLedgerSnapshot snapshot(String portfolioId, String assetId) {
        Portfolio portfolio = require(portfolioId);
        synchronized (portfolio) {
            Position position = portfolio.positions.getOrDefault(assetId, new Position());
            return new RiskLedgerSnapshot(position.side, position.allocation, portfolio.heat,
                    portfolio.volatility.getOrDefault(assetId, 0.0), portfolio.equity, portfolio.highWaterMark);
        }
    }

    @Override
    public void accept(String portfolioId, PipelineOutcome outcome, double allocation) {
        if (!outcome.isApproved() || outcome.action() == TradeAction.HOLD) {
            return;
        }
        Portfolio portfolio = require(portfolioId);
        synchronized (portfolio) {
            Position position = portfolio.positions.computeIfAbsent(outcome.assetId(), ignored -> new Position());
            boolean closing = (outcome.action() == TradeAction.SELL && position.side == PositionSide.LONG)
                    || (outcome.action() == TradeAction.BUY && position.side == PositionSide.SHORT);
            if (closing) {
                portfolio.heat = Math.max(0.0, portfolio.heat - position.risk);
                position.side = PositionSide.FLAT;
                position.allocation = 0.0;
                position.risk = 0.0;
            } else {
                position.side = PositionSide.LONG;
                position.allocation += allocation;
                position.risk += outcome.riskFraction();
                portfolio.heat += outcome.riskFraction();
            }
            log.debug("Booked {} {} in {}: heat={}, allocation={}",
                    outcome.action(), outcome.assetId(), portfolioId, portfolio.heat, position.allocation);
        }
    }

    private Portfolio require(String portfolioId) {
        Portfolio portfolio = portfolios.get(portfolioId);
        if (portfolio == null) {
            throw new RiskLedgerException("Unknown portfolio " + portfolioId);
        }
        return portfolio;
    }
}
