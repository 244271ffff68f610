package com.tradegate.backend.model;

public enum TradeAction {
    BUY,
    SELL,
    HOLD
}
