package com.tradegate.backend.model;

import java.util.Locale;

public enum MetricUnit {
    /** Fractional change, 0.08 means 8%. */
    RATIO,
    /** Percentage points, 8 means 8%. */
    PERCENT,
    CURRENCY,
    /** Indicator or index level such as an RSI reading. */
    POINTS;

    public boolean isChange() {
        return this == RATIO || this == PERCENT;
    }

    public static MetricUnit fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return POINTS;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "ratio", "fraction", "decimal" -> RATIO;
            case "percent", "pct", "%" -> PERCENT;
            case "currency", "usd", "$", "inr", "eur" -> CURRENCY;
            default -> POINTS;
        };
    }
}
