package com.tradegate.backend.trading.pipeline;

import com.tradegate.backend.model.RiskDecision;
import com.tradegate.backend.model.RiskLedgerSnapshot;
import com.tradegate.backend.model.TradeProposal;

public interface RiskEngine {
    RiskDecision evaluate(TradeProposal proposal, RiskLedgerSnapshot snapshot);
}
