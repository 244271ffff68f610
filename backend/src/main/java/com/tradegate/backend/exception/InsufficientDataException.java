package com.tradegate.backend.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends TradingGateException {

    private final int availableBars;
    private final int requiredBars;

    public InsufficientDataException(String assetId, int availableBars, int requiredBars) {
        super("Insufficient price history for " + assetId + ": " + availableBars + " bars, need " + requiredBars);
        this.availableBars = availableBars;
        this.requiredBars = requiredBars;
    }
}
