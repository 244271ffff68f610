package com.tradegate.backend.exception;

public class TradingGateException extends RuntimeException {
    public TradingGateException(String message) {
        super(message);
    }

    public TradingGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
