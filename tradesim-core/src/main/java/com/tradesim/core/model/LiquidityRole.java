package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LiquidityRole {
    MAKER("maker"),
    TAKER("taker");

    private final String value;

    LiquidityRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
