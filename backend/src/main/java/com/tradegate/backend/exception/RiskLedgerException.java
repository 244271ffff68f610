package com.tradegate.backend.exception;

/**
 * The portfolio ledger could not be read. Not recoverable inside the pipeline.
 */
public class RiskLedgerException extends TradingGateException {
    public RiskLedgerException(String message) {
        super(message);
    }

    public RiskLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
