package com.tradesim.runner;

import com.tradesim.core.exception.OrderRejectedException;
import com.tradesim.core.model.Bar;
import com.tradesim.core.model.OrderRequest;
import com.tradesim.core.model.OrderSide;
import com.tradesim.engine.Backtester;
import com.tradesim.engine.SignalContext;
import com.tradesim.engine.SignalStrategy;
import com.tradesim.engine.order.OrderEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Buy-the-dip example signal.
 *
 * Enters with a market buy when the close sits at least {@code pullbackThreshold} below the highest
 * high of the previous {@code lookback} bars. Exits the whole position with a market sell once the
 * close reaches the profit target or the stop relative to the entry close. At most one position is
 * held; the position lives in the {@link SignalContext}.
 *
 * Exits are sized from what actually filled, which {@link #fillTracker} feeds into the context.
 * Entry quantity that fills after the exit signal is sold on the following bars. The tracker counts
 * every fill of the backtester it listens to, so the strategy must be that backtester's only order source.
 */
public class PullbackStrategy implements SignalStrategy {

    private static final Logger log = LoggerFactory.getLogger(PullbackStrategy.class);

    public static final int DEFAULT_LOOKBACK = 20;
    public static final double DEFAULT_PULLBACK_THRESHOLD = 0.03;
    public static final double DEFAULT_PROFIT_TARGET = 0.15;
    public static final double DEFAULT_STOP_LOSS = 0.05;
    public static final double DEFAULT_ORDER_NOTIONAL = 1000.0;

    static final String ENTRY_PRICE = "pullback.entryPrice";
    static final String POSITION = "pullback.position";
    static final String PENDING_EXIT = "pullback.pendingExit";

    private static final double EPSILON = 1e-9;

    private final int lookback;
    private final double pullbackThreshold;
    private final double profitTarget;
    private final double stopLoss;
    private final double orderNotional;

    public PullbackStrategy() {
        this(DEFAULT_LOOKBACK, DEFAULT_PULLBACK_THRESHOLD, DEFAULT_PROFIT_TARGET, DEFAULT_STOP_LOSS,
            DEFAULT_ORDER_NOTIONAL);
    }

    /**
     * @param orderNotional quote amount spent per entry; quantity = orderNotional / close
     */
    public PullbackStrategy(int lookback, double pullbackThreshold, double profitTarget, double stopLoss,
                            double orderNotional) {
        if (lookback <= 0) {
            throw new IllegalArgumentException("lookback must be positive: " + lookback);
        }
        if (pullbackThreshold <= 0 || profitTarget <= 0 || stopLoss <= 0 || orderNotional <= 0) {
            throw new IllegalArgumentException("Thresholds and order notional must be positive");
        }
        this.lookback = lookback;
        this.pullbackThreshold = pullbackThreshold;
        this.profitTarget = profitTarget;
        this.stopLoss = stopLoss;
        this.orderNotional = orderNotional;
    }

    /**
     * Wire the fill tracker into {@code backtester} and run this strategy over its bars.
     */
    public SignalContext runOn(Backtester backtester) throws OrderRejectedException {
        SignalContext context = new SignalContext();
        backtester.addOrderListener(fillTracker(context));
        backtester.runSignals(this, context);
        return context;
    }

    /**
     * Order listener keeping the held quantity and the unfilled exit quantity in {@code context}.
     */
    public Consumer<OrderEvent> fillTracker(SignalContext context) {
        return event -> {
            if (event.fill() == null) {
                return;
            }
            double quantity = event.fill().quantity();
            context.put(POSITION, held(context) + event.side().sign() * quantity);
            if (event.side() == OrderSide.SELL) {
                context.put(PENDING_EXIT, Math.max(0, pendingExit(context) - quantity));
            }
        };
    }

    @Override
    public Optional<OrderRequest> onBar(int index, Bar bar, List<Bar> history, SignalContext context) {
        Double entry = context.get(ENTRY_PRICE, Double.class);
        if (entry != null) {
            return exitSignal(index, bar, entry, context);
        }

        double unsold = held(context) - pendingExit(context);
        if (unsold > EPSILON) {
            log.debug("Bar {}: selling {} filled after exit", index, unsold);
            return sell(unsold, context);
        }
        if (held(context) > EPSILON || history.size() < lookback || bar.close() <= 0) {
            return Optional.empty();
        }

        double recentHigh = recentHigh(history);
        double pullback = pullbackPercent(bar.close(), recentHigh);
        if (pullback > -pullbackThreshold) {
            return Optional.empty();
        }

        double quantity = orderNotional / bar.close();
        context.put(ENTRY_PRICE, bar.close());
        log.debug("Bar {}: pullback {}% from high {}, buying {} @ {}",
            index, String.format("%.2f", pullback * 100), recentHigh, quantity, bar.close());
        return Optional.of(OrderRequest.market(OrderSide.BUY, quantity));
    }

    private Optional<OrderRequest> exitSignal(int index, Bar bar, double entry, SignalContext context) {
        double change = (bar.close() - entry) / entry;
        if (change < profitTarget && change > -stopLoss) {
            return Optional.empty();
        }
        double quantity = held(context) - pendingExit(context);
        if (quantity <= EPSILON) {
            // entry has not filled yet
            return Optional.empty();
        }
        context.remove(ENTRY_PRICE);
        log.debug("Bar {}: {} at {} ({}% from entry {}), selling {}",
            index, change > 0 ? "target" : "stop", bar.close(), String.format("%.2f", change * 100), entry, quantity);
        return sell(quantity, context);
    }

    private Optional<OrderRequest> sell(double quantity, SignalContext context) {
        context.put(PENDING_EXIT, pendingExit(context) + quantity);
        return Optional.of(OrderRequest.market(OrderSide.SELL, quantity));
    }

    private static double held(SignalContext context) {
        return context.getOrDefault(POSITION, Double.class, 0.0);
    }

    private static double pendingExit(SignalContext context) {
        return context.getOrDefault(PENDING_EXIT, Double.class, 0.0);
    }

    private double recentHigh(List<Bar> history) {
        double high = 0;
        for (Bar bar : history.subList(history.size() - lookback, history.size())) {
            high = Math.max(high, bar.high());
        }
        return high;
    }

    /**
     * Negative when price is below the recent high, e.g. -0.03 for a 3% pullback.
     */
    static double pullbackPercent(double price, double recentHigh) {
        if (recentHigh == 0) {
            return 0.0;
        }
        return (price - recentHigh) / recentHigh;
    }

    public int getLookback() {
        return lookback;
    }
}
