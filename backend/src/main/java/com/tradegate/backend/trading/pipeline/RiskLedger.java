package com.tradegate.backend.trading.pipeline;

import com.tradegate.backend.model.RiskLedgerSnapshot;

/**
 * Read-only view of portfolio state. A failure here is an infrastructure problem and
 * propagates to the caller.
 */
public interface RiskLedger {
    RiskLedgerSnapshot snapshot(String portfolioId, String assetId);
}
