package com.tradegate.backend.model;

public record ValidationResult(
        Claim claim,
        Verdict verdict,
        double confidence,
        String evidence,
        ValidationSource source
) {

    public boolean contradicts() {
        return verdict == Verdict.CONTRADICTION;
    }
}
