package com.tradegate.backend.model;

import java.util.List;

public record FactCheckReport(
        List<ValidationResult> results,
        boolean allValid,
        List<String> contradictions,
        int cacheHits
) {

    public static FactCheckReport of(List<ValidationResult> results, int cacheHits) {
        List<String> contradictions = results.stream()
                .filter(ValidationResult::contradicts)
                .map(result -> result.claim().text() + " -> " + result.evidence())
                .toList();
        return new FactCheckReport(List.copyOf(results), contradictions.isEmpty(), contradictions, cacheHits);
    }

    public long degradedCount() {
        return results.stream().filter(result -> result.source() == ValidationSource.FALLBACK).count();
    }
}
