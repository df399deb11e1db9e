package com.tradesim.engine.order;

import com.tradesim.core.exception.OrderRejectedException;
import com.tradesim.core.model.Bar;
import com.tradesim.core.model.Fill;
import com.tradesim.core.model.OrderKind;
import com.tradesim.core.model.OrderSide;
import com.tradesim.core.model.SimulationConfig;
import com.tradesim.engine.fill.BarLiquidity;
import com.tradesim.engine.fill.FillResult;
import com.tradesim.engine.fill.FillSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Tracks every order's fill state across bars and drives its status transitions.
 *
 * Orders are processed in submission order on every bar, so when bar volume is scarce the
 * earliest-submitted order is served first.
 */
public class OrderLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    private final SimulationConfig config;
    private final FillSimulator fillSimulator;

    // orderId -> record, in submission order
    private final Map<String, TradeRecord> records = new LinkedHashMap<>();
    // barIndex -> remaining liquidity, used when orders share bar volume
    private final Map<Integer, BarLiquidity> barBudgets = new HashMap<>();
    private final List<Consumer<OrderEvent>> listeners = new ArrayList<>();
    private long orderIdSeq = 1;

    public OrderLifecycleManager(SimulationConfig config, FillSimulator fillSimulator) {
        this.config = config;
        this.fillSimulator = fillSimulator;
    }

    /**
     * Validate and register a new order. The record moves NEW -> SUBMITTED before it is returned.
     *
     * @param orderId caller-supplied identity, or null to generate one
     * @throws OrderRejectedException if the request is invalid
     */
    public TradeRecord register(String instrument, OrderSide side, double quantity, OrderKind kind,
                                Double limitPrice, int createdBarIndex, Integer timeInForceBars,
                                String orderId) throws OrderRejectedException {
        if (createdBarIndex < 0) {
            throw new IndexOutOfBoundsException("Negative creation bar index: " + createdBarIndex);
        }
        validate(instrument, side, quantity, kind, limitPrice, timeInForceBars, orderId);

        String id = orderId != null && !orderId.isBlank() ? orderId : nextOrderId();
        Order order = new Order(id, instrument, side, quantity, kind, limitPrice, createdBarIndex, timeInForceBars);
        TradeRecord record = new TradeRecord(order);
        record.markSubmitted();
        records.put(id, record);

        logEvent("Order submitted: {} {} {} {} {} @ {} (bar {}, tif {})",
            id, side.getValue(), quantity, instrument, kind.getValue(),
            limitPrice != null ? limitPrice : "market", createdBarIndex,
            timeInForceBars != null ? timeInForceBars : "gtc");
        publish(OrderEvent.submitted(record));
        return record;
    }

    /**
     * Advance every live order by one bar.
     */
    public void processBar(int barIndex, Bar bar) {
        // Snapshot: listeners may submit orders, which join from the next bar on
        for (TradeRecord record : new ArrayList<>(records.values())) {
            if (record.isTerminal()) {
                continue;
            }
            Order order = record.getOrder();
            if (barIndex < order.eligibleBarIndex(config.latencyBars())) {
                continue;
            }

            FillResult result = fillSimulator.simulate(order, bar, record.getRemainingQuantity(),
                liquidityFor(barIndex, bar));
            if (result.isFilled()) {
                Fill fill = result.fill().get();
                record.applyFill(fill, barIndex);
                logEvent("Fill: {} {} {} @ {} fee {} ({}) -> {} {}/{}",
                    order.orderId(), order.side().getValue(), fill.quantity(), fill.price(), fill.fee(),
                    fill.liquidity().getValue(), record.getStatus().getValue(),
                    record.getExecutedQuantity(), order.quantity());
                publish(OrderEvent.filled(record, fill, barIndex));
            }

            // A fill that completes the order wins over expiry on the same bar
            if (!record.isTerminal() && order.isExpired(barIndex)) {
                record.cancel(barIndex);
                logEvent("Order expired: {} after {} bars ({} of {} filled)",
                    order.orderId(), order.timeInForceBars(), record.getExecutedQuantity(), order.quantity());
                publish(OrderEvent.cancelled(record, barIndex));
            }
        }
    }

    /**
     * Cancel a live order. Terminal orders are left untouched.
     *
     * @return true if the order was live and is now cancelled
     */
    public boolean cancel(String orderId, int barIndex) {
        TradeRecord record = records.get(orderId);
        if (record == null) {
            throw new IllegalArgumentException("Unknown order: " + orderId);
        }
        if (record.isTerminal()) {
            return false;
        }
        record.cancel(barIndex);
        logEvent("Order cancelled: {} at bar {}", orderId, barIndex);
        publish(OrderEvent.cancelled(record, barIndex));
        return true;
    }

    public Optional<TradeRecord> find(String orderId) {
        return Optional.ofNullable(records.get(orderId));
    }

    /**
     * All records in submission order.
     */
    public List<TradeRecord> getRecords() {
        return List.copyOf(records.values());
    }

    /**
     * Get all live (non-terminal) records.
     */
    public List<TradeRecord> getActiveRecords() {
        return records.values().stream()
            .filter(r -> !r.isTerminal())
            .toList();
    }

    public void subscribe(Consumer<OrderEvent> listener) {
        listeners.add(listener);
    }

    private BarLiquidity liquidityFor(int barIndex, Bar bar) {
        if (!config.shareBarVolume()) {
            return BarLiquidity.of(fillSimulator.volumeCap(bar));
        }
        return barBudgets.computeIfAbsent(barIndex, i -> BarLiquidity.of(fillSimulator.volumeCap(bar)));
    }

    private void validate(String instrument, OrderSide side, double quantity, OrderKind kind,
                          Double limitPrice, Integer timeInForceBars, String orderId)
            throws OrderRejectedException {
        if (instrument == null || instrument.isBlank()) {
            throw new OrderRejectedException("Instrument is required", OrderRejectedException.MISSING_INSTRUMENT);
        }
        if (side == null) {
            throw new OrderRejectedException("Side must be buy or sell", OrderRejectedException.INVALID_SIDE);
        }
        if (!Double.isFinite(quantity) || quantity <= 0) {
            throw new OrderRejectedException("Quantity must be positive: " + quantity,
                OrderRejectedException.INVALID_QUANTITY);
        }
        if (kind == null) {
            throw new OrderRejectedException("Order type must be market or limit", OrderRejectedException.INVALID_KIND);
        }
        if (kind == OrderKind.LIMIT && (limitPrice == null || !Double.isFinite(limitPrice) || limitPrice <= 0)) {
            throw new OrderRejectedException("Limit order requires a positive limit price",
                OrderRejectedException.MISSING_LIMIT_PRICE);
        }
        if (kind == OrderKind.MARKET && limitPrice != null) {
            throw new OrderRejectedException("Market order must not carry a limit price",
                OrderRejectedException.UNEXPECTED_LIMIT_PRICE);
        }
        if (timeInForceBars != null && timeInForceBars <= 0) {
            throw new OrderRejectedException("Time in force must be a positive bar count: " + timeInForceBars,
                OrderRejectedException.INVALID_TIME_IN_FORCE);
        }
        if (orderId != null && records.containsKey(orderId)) {
            throw new OrderRejectedException("Duplicate order id: " + orderId,
                OrderRejectedException.DUPLICATE_ORDER_ID);
        }
    }

    private String nextOrderId() {
        String id;
        do {
            id = "ord-" + orderIdSeq++;
        } while (records.containsKey(id));
        return id;
    }

    private void publish(OrderEvent event) {
        for (Consumer<OrderEvent> listener : listeners) {
            listener.accept(event);
        }
    }

    private void logEvent(String format, Object... args) {
        if (config.verbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
