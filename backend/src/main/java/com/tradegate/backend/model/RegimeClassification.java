package com.tradegate.backend.model;

import java.time.LocalDate;

public record RegimeClassification(
        String assetId,
        LocalDate asOfDate,
        MarketRegime regime,
        double volatility,
        double trendStrength,
        double meanReversionScore,
        double trailingReturn,
        int barsUsed
) {}
