package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Order lifecycle states.
 * NEW -> SUBMITTED -> PARTIAL -> FILLED, with CANCELLED reachable from SUBMITTED or PARTIAL.
 */
public enum OrderStatus {
    NEW("NEW"),
    SUBMITTED("SUBMITTED"),
    PARTIAL("PARTIAL"),
    FILLED("FILLED"),
    CANCELLED("CANCELLED");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED;
    }
}
