package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Order request returned by a signal strategy (or built by a caller) before submission.
 * Not validated here: the lifecycle manager accepts or rejects it at submission time.
 *
 * @param kind       MARKET when not given
 * @param limitPrice required iff {@code kind} is LIMIT
 * @param timeInForceBars null = good-till-cancel
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderRequest(
    OrderSide side,
    @JsonProperty("quantity") @JsonAlias("qty") double quantity,
    @JsonProperty("order_type") OrderKind kind,
    @JsonProperty("limit_price") Double limitPrice,
    @JsonProperty("time_in_force_bars") Integer timeInForceBars
) {
    public OrderRequest {
        if (kind == null) {
            kind = OrderKind.MARKET;
        }
    }

    public static OrderRequest market(OrderSide side, double quantity) {
        return new OrderRequest(side, quantity, OrderKind.MARKET, null, null);
    }

    public static OrderRequest limit(OrderSide side, double quantity, double limitPrice) {
        return new OrderRequest(side, quantity, OrderKind.LIMIT, limitPrice, null);
    }

    public OrderRequest withTimeInForce(Integer bars) {
        return new OrderRequest(side, quantity, kind, limitPrice, bars);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private OrderSide side;
        private double quantity;
        private OrderKind kind = OrderKind.MARKET;
        private Double limitPrice;
        private Integer timeInForceBars;

        public Builder side(OrderSide side) { this.side = side; return this; }
        public Builder side(String side) { this.side = OrderSide.fromValue(side); return this; }
        public Builder quantity(double quantity) { this.quantity = quantity; return this; }
        public Builder kind(OrderKind kind) { this.kind = kind; return this; }
        public Builder kind(String kind) { this.kind = OrderKind.fromValue(kind); return this; }
        public Builder limitPrice(Double limitPrice) { this.limitPrice = limitPrice; return this; }
        public Builder timeInForceBars(Integer timeInForceBars) { this.timeInForceBars = timeInForceBars; return this; }

        public OrderRequest build() {
            return new OrderRequest(side, quantity, kind, limitPrice, timeInForceBars);
        }
    }
}
