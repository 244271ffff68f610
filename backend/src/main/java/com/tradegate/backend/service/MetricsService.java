package com.tradegate.backend.service;

import com.tradegate.backend.model.PipelineStage;
import com.tradegate.backend.model.ReasonCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void recordOutcome(ReasonCode reasonCode) {
        Counter.builder("pipeline_outcomes_total")
                .tag("reason", reasonCode.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordStageLatency(PipelineStage stage, long elapsedMillis) {
        Timer.builder("pipeline_stage_latency")
                .tag("stage", stage.name())
                .register(meterRegistry)
                .record(Duration.ofMillis(elapsedMillis));
    }

    public void recordLatencyBudgetExceeded(PipelineStage stage) {
        Counter.builder("pipeline_latency_budget_exceeded_total")
                .tag("stage", stage.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("fact_check_cache_lookups_total")
                .tag("result", hit ? "hit" : "miss")
                .register(meterRegistry)
                .increment();
    }

    public void recordClassifierFallback(String cause) {
        Counter.builder("fact_check_fallback_total")
                .tag("cause", cause == null ? "unknown" : cause)
                .register(meterRegistry)
                .increment();
    }

    public void recordSchemaAttempt(boolean valid, int attempt) {
        Counter.builder("schema_gate_attempts_total")
                .tag("valid", Boolean.toString(valid))
                .tag("retry", attempt == 0 ? "first" : "retry")
                .register(meterRegistry)
                .increment();
    }
}
