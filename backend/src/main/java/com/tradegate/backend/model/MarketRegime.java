package com.tradegate.backend.model;

public enum MarketRegime {
    TRENDING_UP,
    TRENDING_DOWN,
    MEAN_REVERTING,
    VOLATILE,
    SIDEWAYS
}
