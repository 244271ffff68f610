package com.tradegate.backend.model;

public enum Verdict {
    ENTAILMENT,
    CONTRADICTION,
    NEUTRAL
}
