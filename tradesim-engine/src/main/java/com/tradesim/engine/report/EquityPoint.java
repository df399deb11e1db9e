package com.tradesim.engine.report;

/**
 * Portfolio state at a bar close.
 */
public record EquityPoint(
    long timestamp,
    double cash,
    double position,
    double equity
) {
}
