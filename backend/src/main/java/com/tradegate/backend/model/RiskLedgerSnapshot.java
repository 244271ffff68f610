package com.tradegate.backend.model;

public record RiskLedgerSnapshot(
        PositionSide side,
        double allocationFraction,
        double portfolioHeat,
        double volatility,
        double equity,
        double highWaterMark
) {

    public RiskLedgerSnapshot {
        if (side == null) {
            side = PositionSide.FLAT;
        }
    }

    public static RiskLedgerSnapshot flat(double portfolioHeat, double equity, double highWaterMark) {
        return new RiskLedgerSnapshot(PositionSide.FLAT, 0.0, portfolioHeat, 0.0, equity, highWaterMark);
    }

    public double drawdown() {
        if (highWaterMark <= 0 || equity >= highWaterMark) {
            return 0.0;
        }
        return 1.0 - equity / highWaterMark;
    }

    public RiskLedgerSnapshot withVolatility(double newVolatility) {
        return new RiskLedgerSnapshot(side, allocationFraction, portfolioHeat, newVolatility, equity, highWaterMark);
    }
}
