package com.tradegate.backend.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class SchemaViolationException extends TradingGateException {

    private final List<String> errors;

    public SchemaViolationException(List<String> errors) {
        super("Agent output failed schema validation: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public SchemaViolationException(String error, Throwable cause) {
        super("Agent output failed schema validation: " + error, cause);
        this.errors = List.of(error);
    }
}
