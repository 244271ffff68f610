package com.tradegate.backend.trading.pipeline;

import com.tradegate.backend.model.GroundTruthFact;
import com.tradegate.backend.model.PriceSeries;

import java.time.LocalDate;
import java.util.Map;

public record EvaluationRequest(
        String portfolioId,
        String assetId,
        LocalDate date,
        PriceSeries series,
        Map<String, GroundTruthFact> groundTruth
) {

    public EvaluationRequest {
        groundTruth = groundTruth == null ? Map.of() : Map.copyOf(groundTruth);
    }
}
