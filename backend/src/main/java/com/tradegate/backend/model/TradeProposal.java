package com.tradegate.backend.model;

import java.time.LocalDate;
import java.util.List;

public record TradeProposal(
        String assetId,
        LocalDate date,
        TradeAction action,
        double proposedRiskFraction,
        List<Claim> supportingClaims,
        MarketRegime regime
) {}
