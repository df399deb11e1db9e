package com.tradesim.engine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradesim.core.model.Fill;
import com.tradesim.core.model.OrderKind;
import com.tradesim.core.model.OrderSide;
import com.tradesim.core.model.OrderStatus;
import com.tradesim.engine.order.TradeRecord;

import java.util.List;

/**
 * Per-trade breakdown row of a {@link PerformanceReport}.
 */
public record TradeDetail(
    @JsonProperty("order_id") String orderId,
    OrderSide side,
    @JsonProperty("order_type") OrderKind orderKind,
    @JsonProperty("requested_qty") double requestedQuantity,
    @JsonProperty("qty") double quantity,
    @JsonProperty("avg_price") double avgPrice,
    double notional,
    double fees,
    OrderStatus status,
    List<Fill> fills
) {
    static TradeDetail of(TradeRecord record) {
        return new TradeDetail(
            record.getOrderId(),
            record.getOrder().side(),
            record.getOrder().kind(),
            record.getOrder().quantity(),
            record.getExecutedQuantity(),
            record.getAvgPrice(),
            record.getFilledNotional(),
            record.getTotalFees(),
            record.getStatus(),
            record.getFills()
        );
    }
}
