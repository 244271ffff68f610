package com.tradegate.backend.trading.pipeline;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.exception.InsufficientDataException;
import com.tradegate.backend.model.FactCheckReport;
import com.tradegate.backend.model.PipelineOutcome;
import com.tradegate.backend.model.PipelineStage;
import com.tradegate.backend.model.ReasonCode;
import com.tradegate.backend.model.RegimeClassification;
import com.tradegate.backend.model.RiskDecision;
import com.tradegate.backend.model.RiskLedgerSnapshot;
import com.tradegate.backend.model.TradeAction;
import com.tradegate.backend.model.TradeProposal;
import com.tradegate.backend.schema.AgentOutputEnvelope;
import com.tradegate.backend.schema.GenerationRequest;
import com.tradegate.backend.schema.ParsedAgentOutput;
import com.tradegate.backend.schema.ProposalAgent;
import com.tradegate.backend.schema.SchemaComplianceGate;
import com.tradegate.backend.service.DecisionAuditService;
import com.tradegate.backend.service.MetricsService;
import com.tradegate.backend.service.indicator.AtrService;
import com.tradegate.backend.service.indicator.RegimeClassifier;
import com.tradegate.backend.validation.FactValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one (asset, date) evaluation through regime classification, the schema gate,
 * fact validation and the risk gate. Every path ends in a fully populated
 * {@link PipelineOutcome}; any failed stage yields HOLD with that stage's reason code.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeDecisionPipelineService {

    private final RegimeClassifier regimeClassifier;
    private final SchemaComplianceGate schemaComplianceGate;
    private final FactValidator factValidator;
    private final RiskEngine riskEngine;
    private final RiskLedger riskLedger;
    private final DecisionSink decisionSink;
    private final PortfolioLockRegistry portfolioLockRegistry;
    private final AtrService atrService;
    private final GateProperties gateProperties;
    private final DecisionAuditService decisionAuditService;
    private final MetricsService metricsService;
    @Qualifier("evaluationExecutor")
    private final Executor evaluationExecutor;

    public PipelineOutcome evaluate(EvaluationRequest request, ProposalAgent agent) {
        if (request == null || request.portfolioId() == null || request.assetId() == null
                || request.date() == null || request.series() == null) {
            throw new IllegalArgumentException("Evaluation request must carry portfolio, asset, date and price series");
        }
        if (agent == null) {
            throw new IllegalArgumentException("Proposal agent is required");
        }
        AuditTrail trail = new AuditTrail();

        trail.startStage();
        RegimeClassification regime;
        try {
            regime = regimeClassifier.classify(request.series(), request.date());
        } catch (InsufficientDataException e) {
            completeStage(trail, PipelineStage.REGIME_CLASSIFICATION, "INSUFFICIENT_DATA", Map.of(
                    "availableBars", e.getAvailableBars(),
                    "requiredBars", e.getRequiredBars()));
            return terminal(request, ReasonCode.INSUFFICIENT_DATA, TradeAction.HOLD, 0.0, trail);
        }
        completeStage(trail, PipelineStage.REGIME_CLASSIFICATION, "REGIME_CLASSIFIED", Map.of(
                "regime", regime.regime().name(),
                "volatility", regime.volatility(),
                "trendStrength", regime.trendStrength(),
                "meanReversionScore", regime.meanReversionScore()));

        trail.startStage();
        AgentOutputEnvelope envelope = schemaComplianceGate.enforce(agent,
                GenerationRequest.initial(request.assetId(), request.date(), regime));
        if (!envelope.isSchemaValid()) {
            completeStage(trail, PipelineStage.SCHEMA_VALIDATION, "SCHEMA_INVALID", Map.of(
                    "retryCount", envelope.getRetryCount(),
                    "errors", envelope.getErrors()));
            return terminal(request, ReasonCode.SCHEMA_INVALID, TradeAction.HOLD, 0.0, trail);
        }
        ParsedAgentOutput output = envelope.getParsed();
        completeStage(trail, PipelineStage.SCHEMA_VALIDATION, "SCHEMA_VALID", Map.of(
                "action", output.action().name(),
                "confidence", output.confidence(),
                "claims", output.keyClaims().size(),
                "retryCount", envelope.getRetryCount()));

        trail.startStage();
        FactCheckReport report = factValidator.validate(request.assetId(), output.keyClaims(),
                request.groundTruth(), request.date());
        long factElapsed = completeStage(trail, PipelineStage.FACT_VALIDATION,
                report.allValid() ? "FACTS_CONSISTENT" : "CONTRADICTION_DETECTED", Map.of(
                        "claims", report.results().size(),
                        "cacheHits", report.cacheHits(),
                        "degraded", report.degradedCount(),
                        "contradictions", report.contradictions()));
        long budgetMs = gateProperties.getPipeline().getFactCheckLatencyBudgetMs();
        if (factElapsed > budgetMs) {
            log.warn("Fact validation for {} on {} took {} ms, over the {} ms budget",
                    request.assetId(), request.date(), factElapsed, budgetMs);
            trail.add(PipelineStage.FACT_VALIDATION, "LATENCY_BUDGET_EXCEEDED", factElapsed,
                    Map.of("budgetMs", budgetMs));
            metricsService.recordLatencyBudgetExceeded(PipelineStage.FACT_VALIDATION);
        }
        if (!report.allValid()) {
            return terminal(request, ReasonCode.FACT_CHECK_FAILED, TradeAction.HOLD, 0.0, trail);
        }

        double requestedRisk = output.action() == TradeAction.HOLD
                ? 0.0
                : output.requestedRisk().orElse(gateProperties.getRisk().getRiskPerTradeMax());
        TradeProposal proposal = new TradeProposal(request.assetId(), request.date(), output.action(),
                requestedRisk, output.keyClaims(), regime.regime());

        return portfolioLockRegistry.withLock(request.portfolioId(), () -> {
            trail.startStage();
            RiskLedgerSnapshot snapshot = withEffectiveVolatility(
                    riskLedger.snapshot(request.portfolioId(), request.assetId()), request);
            RiskDecision decision = riskEngine.evaluate(proposal, snapshot);
            completeStage(trail, PipelineStage.RISK_GATE, decision.rejectionReason().name(), Map.of(
                    "requestedRisk", requestedRisk,
                    "adjustedRisk", decision.adjustedRiskFraction(),
                    "allocation", decision.positionAllocation(),
                    "portfolioHeat", snapshot.portfolioHeat(),
                    "drawdown", snapshot.drawdown(),
                    "reasons", decision.reasons()));
            if (!decision.approved()) {
                return terminal(request, decision.rejectionReason(), TradeAction.HOLD, 0.0, trail);
            }
            PipelineOutcome outcome = terminal(request, ReasonCode.APPROVED, proposal.action(),
                    decision.adjustedRiskFraction(), trail);
            decisionSink.accept(request.portfolioId(), outcome, decision.positionAllocation());
            return outcome;
        });
    }

    /**
     * Evaluates independent requests concurrently; results keep the input order. All submitted
     * evaluations finish before the first failure, if any, is rethrown.
     */
    public List<PipelineOutcome> evaluateAll(List<EvaluationRequest> requests, ProposalAgent agent) {
        List<CompletableFuture<PipelineOutcome>> futures = requests.stream()
                .map(request -> submit(request, agent))
                .toList();
        List<PipelineOutcome> outcomes = new ArrayList<>(futures.size());
        RuntimeException failure = null;
        for (CompletableFuture<PipelineOutcome> future : futures) {
            try {
                outcomes.add(future.join());
            } catch (CompletionException e) {
                if (failure == null) {
                    failure = e.getCause() instanceof RuntimeException runtime ? runtime : e;
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return outcomes;
    }

    private CompletableFuture<PipelineOutcome> submit(EvaluationRequest request, ProposalAgent agent) {
        try {
            return CompletableFuture.supplyAsync(() -> evaluate(request, agent), evaluationExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Evaluation executor saturated, evaluating {} on the calling thread", request.assetId());
            try {
                return CompletableFuture.completedFuture(evaluate(request, agent));
            } catch (RuntimeException ex) {
                return CompletableFuture.failedFuture(ex);
            }
        }
    }

    private RiskLedgerSnapshot withEffectiveVolatility(RiskLedgerSnapshot snapshot, EvaluationRequest request) {
        if (snapshot.volatility() > 0) {
            return snapshot;
        }
        double atrFraction = atrService.calculate(request.series().upTo(request.date())).atrFraction();
        return atrFraction > 0 ? snapshot.withVolatility(atrFraction) : snapshot;
    }

    private long completeStage(AuditTrail trail, PipelineStage stage, String event, Map<String, Object> details) {
        long elapsed = trail.completeStage(stage, event, details);
        metricsService.recordStageLatency(stage, elapsed);
        return elapsed;
    }

    private PipelineOutcome terminal(EvaluationRequest request, ReasonCode reasonCode, TradeAction action,
                                     double riskFraction, AuditTrail trail) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", action.name());
        details.put("riskFraction", riskFraction);
        trail.add(PipelineStage.TERMINAL, reasonCode.name(), 0L, details);

        PipelineOutcome outcome = reasonCode == ReasonCode.APPROVED
                ? PipelineOutcome.approved(request.assetId(), request.date(), action, riskFraction, trail.entries())
                : PipelineOutcome.deadState(request.assetId(), request.date(), reasonCode, trail.entries());
        log.info("Decision for {} on {}: {} {} (risk {})",
                outcome.assetId(), outcome.date(), outcome.reasonCode(), outcome.action(), outcome.riskFraction());
        metricsService.recordOutcome(outcome.reasonCode());
        decisionAuditService.recordOutcome(outcome);
        return outcome;
    }
}
