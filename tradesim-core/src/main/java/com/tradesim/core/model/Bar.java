package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * OHLCV bar: one fixed-interval summary of price activity.
 * Timestamps are epoch milliseconds. Immutable once created.
 */
public record Bar(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public Bar {
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low) || !Double.isFinite(close)) {
            throw new IllegalArgumentException("Bar prices must be finite at " + timestamp);
        }
        if (!Double.isFinite(volume) || volume < 0) {
            throw new IllegalArgumentException("Bar volume must be non-negative at " + timestamp + ": " + volume);
        }
    }

    /**
     * Check if this is a bullish bar (close > open)
     */
    @JsonIgnore
    public boolean isBullish() {
        return close > open;
    }

    /**
     * Check if this is a bearish bar (close < open)
     */
    @JsonIgnore
    public boolean isBearish() {
        return close < open;
    }

    /**
     * Get the body size (absolute difference between open and close)
     */
    @JsonIgnore
    public double bodySize() {
        return Math.abs(close - open);
    }

    /**
     * Get the range (high - low)
     */
    @JsonIgnore
    public double range() {
        return high - low;
    }
}
