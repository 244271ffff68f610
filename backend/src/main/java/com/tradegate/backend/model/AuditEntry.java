package com.tradegate.backend.model;

import java.util.Map;

public record AuditEntry(
        PipelineStage stage,
        String event,
        long elapsedMillis,
        Map<String, Object> details
) {

    public AuditEntry {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
