package com.tradesim.engine.order;

import com.tradesim.core.model.Fill;
import com.tradesim.core.model.OrderSide;
import com.tradesim.core.model.OrderStatus;

/**
 * Lifecycle event emitted by the {@link OrderLifecycleManager} in processing order.
 *
 * @param fill the fill for PARTIAL_FILL / FILLED events, null otherwise
 */
public record OrderEvent(
    Type type,
    String orderId,
    OrderSide side,
    int barIndex,
    OrderStatus status,
    double executedQuantity,
    Fill fill
) {
    public enum Type {
        SUBMITTED,
        PARTIAL_FILL,
        FILLED,
        CANCELLED
    }

    static OrderEvent submitted(TradeRecord record) {
        return new OrderEvent(Type.SUBMITTED, record.getOrderId(), record.getOrder().side(),
            record.getOrder().createdBarIndex(), record.getStatus(), record.getExecutedQuantity(), null);
    }

    static OrderEvent filled(TradeRecord record, Fill fill, int barIndex) {
        Type type = record.getStatus() == OrderStatus.FILLED ? Type.FILLED : Type.PARTIAL_FILL;
        return new OrderEvent(type, record.getOrderId(), record.getOrder().side(), barIndex, record.getStatus(),
            record.getExecutedQuantity(), fill);
    }

    static OrderEvent cancelled(TradeRecord record, int barIndex) {
        return new OrderEvent(Type.CANCELLED, record.getOrderId(), record.getOrder().side(), barIndex, record.getStatus(),
            record.getExecutedQuantity(), null);
    }
}
