package com.tradegate.backend.schema;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.exception.SchemaViolationException;
import com.tradegate.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded regenerate-until-valid loop around the proposal agent. Never returns null:
 * exhaustion yields an envelope with {@code schemaValid == false}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaComplianceGate {

    private final AgentOutputParser agentOutputParser;
    private final GateProperties gateProperties;
    private final MetricsService metricsService;

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong firstTrySuccesses = new AtomicLong();
    private final AtomicLong retrySuccesses = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public record RetryStats(long totalCalls, long firstTrySuccesses, long retrySuccesses, long failures) {
        public double failureRate() {
            return totalCalls == 0 ? 0.0 : (double) failures / totalCalls;
        }
    }

    public AgentOutputEnvelope enforce(ProposalAgent agent, GenerationRequest request) {
        totalCalls.incrementAndGet();
        int maxRetries = gateProperties.getSchema().getMaxRetries();
        AgentOutputEnvelope envelope = new AgentOutputEnvelope();
        GenerationRequest current = request;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                envelope.incrementRetry();
            }
            String raw;
            try {
                raw = agent.generate(current);
            } catch (RuntimeException e) {
                List<String> errors = List.of("agent call failed: " + e.getMessage());
                log.warn("Proposal agent failed for {} on attempt {}: {}", request.assetId(), attempt, e.getMessage());
                envelope.replace(null, null, errors);
                metricsService.recordSchemaAttempt(false, attempt);
                current = current.retry(null, errors);
                continue;
            }
            try {
                ParsedAgentOutput parsed = agentOutputParser.parse(raw);
                envelope.replace(raw, parsed, List.of());
                metricsService.recordSchemaAttempt(true, attempt);
                if (attempt == 0) {
                    firstTrySuccesses.incrementAndGet();
                } else {
                    retrySuccesses.incrementAndGet();
                }
                return envelope;
            } catch (SchemaViolationException e) {
                log.debug("Schema violation for {} on attempt {}: {}", request.assetId(), attempt, e.getErrors());
                envelope.replace(raw, null, e.getErrors());
                metricsService.recordSchemaAttempt(false, attempt);
                current = current.retry(raw, e.getErrors());
            }
        }

        failures.incrementAndGet();
        log.warn("Agent output for {} on {} still invalid after {} retries: {}",
                request.assetId(), request.date(), envelope.getRetryCount(), envelope.getErrors());
        return envelope;
    }

    public RetryStats stats() {
        return new RetryStats(totalCalls.get(), firstTrySuccesses.get(), retrySuccesses.get(), failures.get());
    }
}
