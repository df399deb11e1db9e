package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderSide {
    BUY("buy"),
    SELL("sell");

    private final String value;

    OrderSide(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse "buy"/"sell" (case-insensitive). Returns null for anything else so the
     * caller can reject the request with a reason.
     */
    @JsonCreator
    public static OrderSide fromValue(String value) {
        if (value == null) return null;
        for (OrderSide side : values()) {
            if (side.value.equalsIgnoreCase(value.trim())) {
                return side;
            }
        }
        return null;
    }

    /**
     * +1 for buys, -1 for sells.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
