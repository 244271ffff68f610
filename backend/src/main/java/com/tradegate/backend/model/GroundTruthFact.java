package com.tradegate.backend.model;

import java.time.LocalDate;

public record GroundTruthFact(
        String metricName,
        double value,
        MetricUnit unit,
        LocalDate scopeDate
) {

    public GroundTruthFact {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName is required");
        }
        if (unit == null) {
            unit = MetricUnit.POINTS;
        }
    }
}
