package com.tradegate.backend.trading.pipeline;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.PositionSide;
import com.tradegate.backend.model.ReasonCode;
import com.tradegate.backend.model.RiskDecision;
import com.tradegate.backend.model.RiskLedgerSnapshot;
import com.tradegate.backend.model.TradeAction;
import com.tradegate.backend.model.TradeProposal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based gate: position transition, circuit breaker, volatility sizing, portfolio heat,
 * in that order. Reads the snapshot only; booking approved risk is the sink's job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeterministicRiskEngine implements RiskEngine {

    private static final double EPSILON = 1e-9;

    private final GateProperties gateProperties;

    @Override
    public RiskDecision evaluate(TradeProposal proposal, RiskLedgerSnapshot snapshot) {
        GateProperties.Risk limits = gateProperties.getRisk();
        TradeAction action = proposal.action();
        PositionSide side = snapshot.side();

        if (action == TradeAction.HOLD) {
            return RiskDecision.approve(0.0, 0.0, List.of("Hold requires no risk"));
        }
        if (action == TradeAction.SELL && side != PositionSide.LONG) {
            return RiskDecision.reject(ReasonCode.INVALID_POSITION_TRANSITION,
                    "SELL requires an existing long position, current position is " + side);
        }
        if (action == TradeAction.BUY && side == PositionSide.LONG
                && snapshot.allocationFraction() >= limits.getMaxAssetExposure() - EPSILON) {
            return RiskDecision.reject(ReasonCode.INVALID_POSITION_TRANSITION, String.format(Locale.ROOT,
                    "BUY would exceed max asset exposure %.4f (current allocation %.4f)",
                    limits.getMaxAssetExposure(), snapshot.allocationFraction()));
        }

        double requested = Math.max(0.0, proposal.proposedRiskFraction());
        double risk = Math.min(requested, limits.getRiskPerTradeMax());

        if (isRiskReducing(action, side)) {
            return RiskDecision.approve(risk, snapshot.allocationFraction(),
                    List.of("Risk-reducing " + action + " against " + side + " position"));
        }

        if (snapshot.drawdown() > limits.getCircuitBreakerDrawdown()) {
            return RiskDecision.reject(ReasonCode.CIRCUIT_BREAKER, String.format(Locale.ROOT,
                    "Drawdown %.4f exceeds circuit breaker threshold %.4f",
                    snapshot.drawdown(), limits.getCircuitBreakerDrawdown()));
        }

        List<String> reasons = new ArrayList<>();
        if (requested > risk) {
            reasons.add(String.format(Locale.ROOT, "Requested risk %.4f capped to per-trade max %.4f",
                    requested, limits.getRiskPerTradeMax()));
        }
        double volatility = snapshot.volatility() > 0 ? snapshot.volatility() : limits.getDefaultVolatility();
        double allocation = risk / (limits.getAtrStopMultiple() * volatility);
        double exposureHeadroom = limits.getMaxAssetExposure() - snapshot.allocationFraction();
        if (allocation > exposureHeadroom) {
            // exposure bounds the position size only; the risk budget is governed by heat
            allocation = exposureHeadroom;
            reasons.add(String.format(Locale.ROOT, "Allocation limited to remaining asset exposure %.4f",
                    exposureHeadroom));
        }

        double heatHeadroom = limits.getPortfolioHeatMax() - snapshot.portfolioHeat();
        if (heatHeadroom <= EPSILON) {
            return RiskDecision.reject(ReasonCode.RISK_LIMIT_EXCEEDED, String.format(Locale.ROOT,
                    "Portfolio heat %.4f leaves no headroom under limit %.4f",
                    snapshot.portfolioHeat(), limits.getPortfolioHeatMax()));
        }
        if (risk > heatHeadroom) {
            allocation *= heatHeadroom / risk;
            risk = heatHeadroom;
            reasons.add(String.format(Locale.ROOT, "Risk capped to portfolio heat headroom %.4f", heatHeadroom));
        }
        if (risk <= EPSILON) {
            return RiskDecision.reject(ReasonCode.RISK_LIMIT_EXCEEDED, "Sized risk is zero");
        }

        log.debug("Risk approved for {} {}: risk={}, allocation={}, vol={}",
                proposal.assetId(), action, risk, allocation, volatility);
        reasons.add(String.format(Locale.ROOT, "Sized at risk %.4f, allocation %.4f", risk, allocation));
        return RiskDecision.approve(risk, allocation, reasons);
    }

    static boolean isRiskReducing(TradeAction action, PositionSide side) {
        return (action == TradeAction.SELL && side == PositionSide.LONG)
                || (action == TradeAction.BUY && side == PositionSide.SHORT);
    }
}
