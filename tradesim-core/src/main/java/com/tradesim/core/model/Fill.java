package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single execution against one bar. Append-only; owned by the order's trade record.
 */
public record Fill(
    @JsonProperty("ts") long barTimestamp,
    double price,
    @JsonProperty("qty") double quantity,
    double fee,
    LiquidityRole liquidity
) {
    public Fill {
        if (!(quantity > 0)) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + quantity);
        }
        if (fee < 0) {
            throw new IllegalArgumentException("Fill fee must be non-negative: " + fee);
        }
    }

    @JsonIgnore
    public double notionalValue() {
        return price * quantity;
    }
}
