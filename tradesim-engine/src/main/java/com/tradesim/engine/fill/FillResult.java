package com.tradesim.engine.fill;

import com.tradesim.core.model.Fill;

import java.util.Optional;

/**
 * Outcome of one fill attempt: the fill (if any) and the quantity it consumed.
 */
public record FillResult(Optional<Fill> fill, double consumedQuantity) {

    private static final FillResult NONE = new FillResult(Optional.empty(), 0);

    public static FillResult none() {
        return NONE;
    }

    public static FillResult of(Fill fill) {
        return new FillResult(Optional.of(fill), fill.quantity());
    }

    public boolean isFilled() {
        return fill.isPresent();
    }
}
