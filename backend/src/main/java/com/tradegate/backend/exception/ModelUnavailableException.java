package com.tradegate.backend.exception;

public class ModelUnavailableException extends TradingGateException {
    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
