package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderKind {
    MARKET("market"),
    LIMIT("limit");

    private final String value;

    OrderKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse "market"/"limit" (case-insensitive). A missing value means MARKET.
     *
     * @throws IllegalArgumentException for any other value
     */
    @JsonCreator
    public static OrderKind fromValue(String value) {
        if (value == null || value.isBlank()) return MARKET;
        for (OrderKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown order type: " + value);
    }
}
