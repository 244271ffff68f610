package com.tradegate.backend.model;

public enum ReasonCode {
    APPROVED,
    SCHEMA_INVALID,
    FACT_CHECK_FAILED,
    INVALID_POSITION_TRANSITION,
    RISK_LIMIT_EXCEEDED,
    CIRCUIT_BREAKER,
    INSUFFICIENT_DATA;

    public boolean isRejection() {
        return this != APPROVED;
    }
}
