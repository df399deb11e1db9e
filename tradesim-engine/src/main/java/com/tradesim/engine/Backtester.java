package com.tradesim.engine;

import com.tradesim.core.exception.OrderRejectedException;
import com.tradesim.core.model.Bar;
import com.tradesim.core.model.BarStore;
import com.tradesim.core.model.OrderKind;
import com.tradesim.core.model.OrderRequest;
import com.tradesim.core.model.OrderSide;
import com.tradesim.core.model.SimulationConfig;
import com.tradesim.engine.fill.FillSimulator;
import com.tradesim.engine.order.OrderEvent;
import com.tradesim.engine.order.OrderLifecycleManager;
import com.tradesim.engine.order.TradeRecord;
import com.tradesim.engine.report.PerformanceReport;
import com.tradesim.engine.report.PerformanceReporter;
import com.tradesim.engine.report.PortfolioLedger;
import com.tradesim.engine.report.PortfolioSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Replays a bar series, feeding a signal strategy and simulating execution of its orders.
 *
 * A Backtester owns its bars, orders and counters exclusively and is single-threaded:
 * given the same bars, config and strategy, every run produces the same fills.
 */
public class Backtester {

    private static final Logger log = LoggerFactory.getLogger(Backtester.class);

    private final BarStore bars;
    private final SimulationConfig config;
    private final OrderLifecycleManager lifecycle;
    private final PerformanceReporter reporter;

    public Backtester(List<Bar> bars, SimulationConfig config) {
        this(new BarStore(bars), config);
    }

    public Backtester(BarStore bars, SimulationConfig config) {
        this.bars = Objects.requireNonNull(bars, "bars");
        this.config = Objects.requireNonNull(config, "config");
        this.lifecycle = new OrderLifecycleManager(config, new FillSimulator(config));
        this.reporter = new PerformanceReporter();
    }

    /**
     * Submit an order created on {@code createdBarIndex}.
     *
     * @param timeInForceBars null = good-till-cancel
     * @param orderId         null to generate one
     * @return the record tracking the order
     * @throws OrderRejectedException    if the request is invalid
     * @throws IndexOutOfBoundsException if {@code createdBarIndex} does not name a bar
     */
    public TradeRecord submitOrder(String instrument, OrderSide side, double quantity, OrderKind kind,
                                   Double limitPrice, int createdBarIndex, Integer timeInForceBars,
                                   String orderId) throws OrderRejectedException {
        Objects.checkIndex(createdBarIndex, bars.size());
        return lifecycle.register(instrument, side, quantity, kind, limitPrice, createdBarIndex,
            timeInForceBars, orderId);
    }

    /**
     * Submit a request for the configured instrument.
     */
    public TradeRecord submitOrder(OrderRequest request, int createdBarIndex) throws OrderRejectedException {
        return submitOrder(config.instrument(), request.side(), request.quantity(), request.kind(),
            request.limitPrice(), createdBarIndex, request.timeInForceBars(), null);
    }

    /**
     * Process all live orders against the single bar at {@code barIndex}.
     */
    public void stepBar(int barIndex) {
        lifecycle.processBar(barIndex, bars.get(barIndex));
    }

    /**
     * Process bars from {@code fromIndex} through the last bar.
     */
    public void stepThroughBars(int fromIndex) {
        stepThroughBars(fromIndex, bars.size() - 1);
    }

    /**
     * Process bars {@code fromIndex..toIndexInclusive} in order.
     */
    public void stepThroughBars(int fromIndex, int toIndexInclusive) {
        Objects.checkIndex(fromIndex, bars.size());
        Objects.checkIndex(toIndexInclusive, bars.size());
        for (int i = fromIndex; i <= toIndexInclusive; i++) {
            stepBar(i);
        }
    }

    /**
     * Run a strategy over the bars with a fresh context.
     */
    public SignalContext runSignals(SignalStrategy strategy) throws OrderRejectedException {
        SignalContext context = new SignalContext();
        runSignals(strategy, context);
        return context;
    }

    /**
     * Walk bars from the warm-up offset to the end. On each bar: ask the strategy for a request,
     * submit it on that bar, then process every live order against the bar.
     *
     * @throws OrderRejectedException if the strategy returns an invalid request
     */
    public void runSignals(SignalStrategy strategy, SignalContext context) throws OrderRejectedException {
        Objects.requireNonNull(strategy, "strategy");
        int signals = 0;
        log.info("Running backtest on {} bars (instrument={}, warmup={}, latency={})",
            bars.size(), config.instrument(), config.warmupBars(), config.latencyBars());

        for (int i = config.warmupBars(); i < bars.size(); i++) {
            Bar bar = bars.get(i);
            Optional<OrderRequest> request = strategy.onBar(i, bar, bars.history(i), context);
            if (request != null && request.isPresent()) {
                signals++;
                submitOrder(request.get(), i);
            }
            stepBar(i);
        }

        log.info("Backtest complete: {} signals, {} orders, {} still active",
            signals, lifecycle.getRecords().size(), lifecycle.getActiveRecords().size());
    }

    /**
     * Cancel a live order as of {@code barIndex}.
     *
     * @return true if the order was live
     */
    public boolean cancelOrder(String orderId, int barIndex) {
        Objects.checkIndex(barIndex, bars.size());
        return lifecycle.cancel(orderId, barIndex);
    }

    /**
     * All trade records in submission order.
     */
    public List<TradeRecord> trades() {
        return lifecycle.getRecords();
    }

    public Optional<TradeRecord> findTrade(String orderId) {
        return lifecycle.find(orderId);
    }

    public PerformanceReport computePerformance() {
        return reporter.compute(lifecycle.getRecords());
    }

    /**
     * Mark-to-market the filled orders against the bar closes, starting from the configured cash.
     */
    public PortfolioSummary computePortfolio() {
        return PortfolioLedger.replay(bars, lifecycle.getRecords(), config.startingCash());
    }

    public void addOrderListener(Consumer<OrderEvent> listener) {
        lifecycle.subscribe(listener);
    }

    public BarStore getBars() {
        return bars;
    }

    public SimulationConfig getConfig() {
        return config;
    }
}
