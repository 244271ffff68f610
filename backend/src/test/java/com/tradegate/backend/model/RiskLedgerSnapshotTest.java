package com.tradegate.backend.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskLedgerSnapshotTest {

    @Test
    void drawdownIsMeasuredFromHighWaterMark() {
        assertThat(RiskLedgerSnapshot.flat(0.05, 90_000, 100_000).drawdown()).isCloseTo(0.1, within(1e-12));
        assertThat(RiskLedgerSnapshot.flat(0, 110_000, 100_000).drawdown()).isZero();
        assertThat(RiskLedgerSnapshot.flat(0, 0, 0).drawdown()).isZero();
    }

    @Test
    void missingSideMeansFlat() {
        RiskLedgerSnapshot snapshot = new RiskLedgerSnapshot(null, 0, 0, 0, 1, 1);

        assertThat(snapshot.side()).isEqualTo(PositionSide.FLAT);
        assertThat(snapshot.withVolatility(0.03).volatility()).isEqualTo(0.03);
    }
}
