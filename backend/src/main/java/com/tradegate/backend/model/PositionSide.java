package com.tradegate.backend.model;

public enum PositionSide {
    FLAT,
    LONG,
    SHORT
}
