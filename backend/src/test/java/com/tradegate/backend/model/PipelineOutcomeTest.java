package com.tradegate.backend.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineOutcomeTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Test
    void deadStateIsHoldWithZeroRisk() {
        PipelineOutcome outcome = PipelineOutcome.deadState("AAPL", DAY, ReasonCode.SCHEMA_INVALID, null);

        assertThat(outcome.action()).isEqualTo(TradeAction.HOLD);
        assertThat(outcome.riskFraction()).isZero();
        assertThat(outcome.auditTrail()).isEmpty();
        assertThat(outcome.isApproved()).isFalse();
    }

    @Test
    void rejectionCannotCarryTradeAction() {
        assertThatThrownBy(() -> new PipelineOutcome("AAPL", DAY, TradeAction.BUY, 0.02,
                ReasonCode.RISK_LIMIT_EXCEEDED, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deadStateRequiresRejectionReason() {
        assertThatThrownBy(() -> PipelineOutcome.deadState("AAPL", DAY, ReasonCode.APPROVED, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outcomeMustBeFullyPopulated() {
        assertThatThrownBy(() -> PipelineOutcome.approved("AAPL", null, TradeAction.BUY, 0.01, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
