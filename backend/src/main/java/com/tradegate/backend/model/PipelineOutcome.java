package com.tradegate.backend.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Terminal record of one evaluation. Rejections always carry HOLD and zero risk.
 */
public record PipelineOutcome(
        String assetId,
        LocalDate date,
        TradeAction action,
        double riskFraction,
        ReasonCode reasonCode,
        List<AuditEntry> auditTrail
) {

    public PipelineOutcome {
        if (assetId == null || date == null || action == null || reasonCode == null) {
            throw new IllegalArgumentException("Pipeline outcome must be fully populated");
        }
        if (reasonCode.isRejection() && (action != TradeAction.HOLD || riskFraction != 0.0)) {
            throw new IllegalArgumentException("Rejected outcome " + reasonCode + " must be HOLD with zero risk");
        }
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }

    public static PipelineOutcome approved(String assetId, LocalDate date, TradeAction action, double riskFraction,
                                           List<AuditEntry> auditTrail) {
        return new PipelineOutcome(assetId, date, action, riskFraction, ReasonCode.APPROVED, auditTrail);
    }

    public static PipelineOutcome deadState(String assetId, LocalDate date, ReasonCode reasonCode,
                                            List<AuditEntry> auditTrail) {
        if (!reasonCode.isRejection()) {
            throw new IllegalArgumentException("Dead state requires a rejection reason");
        }
        return new PipelineOutcome(assetId, date, TradeAction.HOLD, 0.0, reasonCode, auditTrail);
    }

    public boolean isApproved() {
        return reasonCode == ReasonCode.APPROVED;
    }
}
