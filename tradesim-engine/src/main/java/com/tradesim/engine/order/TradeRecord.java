package com.tradesim.engine.order;

import com.tradesim.core.model.Fill;
import com.tradesim.core.model.OrderStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Order plus its fills and derived execution state.
 * Only the lifecycle manager mutates a record; once terminal it never changes again.
 */
public class TradeRecord {

    /** Relative tolerance under which a cumulative fill counts as complete. */
    static final double FILL_TOLERANCE = 1e-9;

    private final Order order;
    private final List<Fill> fills = new ArrayList<>();

    private OrderStatus status = OrderStatus.NEW;
    private double executedQuantity;
    private double filledNotional;
    private double totalFees;
    private Integer closedBarIndex;

    TradeRecord(Order order) {
        this.order = order;
    }

    void markSubmitted() {
        if (status != OrderStatus.NEW) {
            throw new IllegalStateException("Order " + order.orderId() + " already " + status);
        }
        status = OrderStatus.SUBMITTED;
    }

    void applyFill(Fill fill, int barIndex) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot fill " + status + " order " + order.orderId());
        }
        fills.add(fill);
        filledNotional += fill.notionalValue();
        totalFees += fill.fee();
        // Clamp guards against a last-ulp overshoot when the final fill takes exactly the remainder
        executedQuantity = Math.min(order.quantity(), executedQuantity + fill.quantity());

        if (executedQuantity >= order.quantity() * (1 - FILL_TOLERANCE)) {
            status = OrderStatus.FILLED;
            closedBarIndex = barIndex;
        } else {
            status = OrderStatus.PARTIAL;
        }
    }

    void cancel(int barIndex) {
        if (status.isTerminal()) {
            return;
        }
        status = OrderStatus.CANCELLED;
        closedBarIndex = barIndex;
    }

    public Order getOrder() { return order; }
    public String getOrderId() { return order.orderId(); }
    public OrderStatus getStatus() { return status; }
    public double getExecutedQuantity() { return executedQuantity; }
    public double getTotalFees() { return totalFees; }
    public double getFilledNotional() { return filledNotional; }
    public List<Fill> getFills() { return List.copyOf(fills); }
    public int getFillCount() { return fills.size(); }

    /**
     * Bar index on which the record became terminal, or null while it is still live.
     */
    public Integer getClosedBarIndex() { return closedBarIndex; }

    /**
     * Volume-weighted average fill price, 0 when nothing has filled.
     */
    public double getAvgPrice() {
        return executedQuantity > 0 ? filledNotional / sumFillQuantity() : 0;
    }

    public double getRemainingQuantity() {
        return Math.max(0, order.quantity() - executedQuantity);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasExecutions() {
        return executedQuantity > 0;
    }

    private double sumFillQuantity() {
        double sum = 0;
        for (Fill fill : fills) {
            sum += fill.quantity();
        }
        return sum;
    }

    @Override
    public String toString() {
        return String.format("TradeRecord[%s %s %s %.6f/%.6f @ %.6f %s]",
            order.orderId(), order.side().getValue(), order.kind().getValue(),
            executedQuantity, order.quantity(), getAvgPrice(), status.getValue());
    }
}
