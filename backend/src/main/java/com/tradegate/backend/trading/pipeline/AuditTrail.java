package com.tradegate.backend.trading.pipeline;

import com.tradegate.backend.model.AuditEntry;
import com.tradegate.backend.model.PipelineStage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-evaluation stage log. Not thread-safe; one instance per evaluation.
 */
class AuditTrail {

    private final List<AuditEntry> entries = new ArrayList<>();
    private long stageStartNanos = System.nanoTime();

    void startStage() {
        stageStartNanos = System.nanoTime();
    }

    long elapsedMillis() {
        return (System.nanoTime() - stageStartNanos) / 1_000_000L;
    }

    long completeStage(PipelineStage stage, String event, Map<String, Object> details) {
        long elapsed = elapsedMillis();
        add(stage, event, elapsed, details);
        return elapsed;
    }

    void add(PipelineStage stage, String event, long elapsedMillis, Map<String, Object> details) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        details.forEach((key, value) -> {
            if (value != null) {
                cleaned.put(key, value);
            }
        });
        entries.add(new AuditEntry(stage, event, elapsedMillis, cleaned));
    }

    List<AuditEntry> entries() {
        return List.copyOf(entries);
    }
}
