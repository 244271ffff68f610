package com.tradegate.backend.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Chronological OHLCV history for one asset. Immutable once built.
 */
public final class PriceSeries {

    private final String assetId;
    private final List<PriceBar> bars;

    public PriceSeries(String assetId, List<PriceBar> bars) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId is required");
        }
        if (bars == null) {
            throw new IllegalArgumentException("bars are required");
        }
        for (int i = 0; i < bars.size(); i++) {
            PriceBar bar = bars.get(i);
            if (bar == null || !(bar.close() > 0)) {
                throw new IllegalArgumentException("Price bar " + i + " for " + assetId + " has no positive close");
            }
            if (i == 0) {
                continue;
            }
            LocalDate prev = bars.get(i - 1).date();
            LocalDate curr = bars.get(i).date();
            if (prev == null || curr == null || !curr.isAfter(prev)) {
                throw new IllegalArgumentException("Price bars for " + assetId + " are not strictly chronological at index " + i);
            }
        }
        this.assetId = assetId;
        this.bars = List.copyOf(bars);
    }

    public String assetId() {
        return assetId;
    }

    public List<PriceBar> bars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public PriceBar last() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    /**
     * Bars dated on or before {@code asOf}; a replay never sees the future.
     */
    public List<PriceBar> upTo(LocalDate asOf) {
        if (asOf == null) {
            return bars;
        }
        List<PriceBar> visible = new ArrayList<>();
        for (PriceBar bar : bars) {
            if (bar.date().isAfter(asOf)) {
                break;
            }
            visible.add(bar);
        }
        return List.copyOf(visible);
    }

    /**
     * The last {@code count} bars visible at {@code asOf}, or fewer when the history is shorter.
     */
    public List<PriceBar> trailing(LocalDate asOf, int count) {
        List<PriceBar> visible = upTo(asOf);
        if (count >= visible.size()) {
            return visible;
        }
        return visible.subList(visible.size() - count, visible.size());
    }
}
