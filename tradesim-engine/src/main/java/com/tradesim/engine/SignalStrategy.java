package com.tradesim.engine;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.OrderRequest;

import java.util.List;
import java.util.Optional;

/**
 * Pluggable signal callback invoked once per bar by {@link Backtester#runSignals}.
 * Implementations may be lambdas or stateful strategy objects.
 */
@FunctionalInterface
public interface SignalStrategy {

    /**
     * @param index   index of the current bar
     * @param bar     the current bar
     * @param history all bars strictly before {@code index}
     * @param context mutable state shared across calls of one run
     * @return an order request to submit on this bar, or empty
     */
    Optional<OrderRequest> onBar(int index, Bar bar, List<Bar> history, SignalContext context);
}
