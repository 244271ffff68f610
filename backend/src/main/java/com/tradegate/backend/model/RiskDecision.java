package com.tradegate.backend.model;

import java.util.List;

public record RiskDecision(
        boolean approved,
        double adjustedRiskFraction,
        double positionAllocation,
        ReasonCode rejectionReason,
        List<String> reasons
) {

    public static RiskDecision approve(double riskFraction, double allocation, List<String> reasons) {
        return new RiskDecision(true, riskFraction, allocation, ReasonCode.APPROVED, List.copyOf(reasons));
    }

    public static RiskDecision reject(ReasonCode reason, String message) {
        return new RiskDecision(false, 0.0, 0.0, reason, List.of(message));
    }
}
