package com.tradesim.core.exception;

/**
 * Thrown when an order request fails validation at submission.
 */
public class OrderRejectedException extends SimulationException {

    public static final String INVALID_SIDE = "INVALID_SIDE";
    public static final String INVALID_QUANTITY = "INVALID_QUANTITY";
    public static final String INVALID_KIND = "INVALID_KIND";
    public static final String MISSING_LIMIT_PRICE = "MISSING_LIMIT_PRICE";
    public static final String UNEXPECTED_LIMIT_PRICE = "UNEXPECTED_LIMIT_PRICE";
    public static final String INVALID_TIME_IN_FORCE = "INVALID_TIME_IN_FORCE";
    public static final String MISSING_INSTRUMENT = "MISSING_INSTRUMENT";
    public static final String DUPLICATE_ORDER_ID = "DUPLICATE_ORDER_ID";

    private final String rejectReason;

    public OrderRejectedException(String message, String rejectReason) {
        super(message);
        this.rejectReason = rejectReason;
    }

    public String getRejectReason() {
        return rejectReason;
    }
}
