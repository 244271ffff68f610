package com.tradegate.backend.model;

public enum ValidationSource {
    NUMERIC,
    SEMANTIC,
    FALLBACK
}
