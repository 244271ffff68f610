package com.tradegate.backend.model;

public enum PipelineStage {
    REGIME_CLASSIFICATION,
    SCHEMA_VALIDATION,
    FACT_VALIDATION,
    RISK_GATE,
    TERMINAL
}
