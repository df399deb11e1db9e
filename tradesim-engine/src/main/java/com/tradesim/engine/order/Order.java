package com.tradesim.engine.order;

import com.tradesim.core.model.OrderKind;
import com.tradesim.core.model.OrderSide;

/**
 * A submitted order. Immutable; fill state lives in the owning {@link TradeRecord}.
 *
 * @param limitPrice      set iff {@code kind} is LIMIT
 * @param createdBarIndex bar index the order was created on
 * @param timeInForceBars bars until automatic cancellation, null = good-till-cancel
 */
public record Order(
    String orderId,
    String instrument,
    OrderSide side,
    double quantity,
    OrderKind kind,
    Double limitPrice,
    int createdBarIndex,
    Integer timeInForceBars
) {
    public boolean isGoodTillCancel() {
        return timeInForceBars == null;
    }

    /**
     * First bar index on which a fill may be attempted.
     */
    public int eligibleBarIndex(int latencyBars) {
        return createdBarIndex + latencyBars;
    }

    /**
     * Check if the time-in-force window has elapsed at {@code currentBar}.
     */
    public boolean isExpired(int currentBar) {
        return timeInForceBars != null && currentBar - createdBarIndex >= timeInForceBars;
    }
}
