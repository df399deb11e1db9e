package com.tradesim.core.exception;

/**
 * Bar data could not be read or did not form a valid series.
 */
public class BarDataException extends SimulationException {

    private final int lineNumber;

    public BarDataException(String message) {
        this(message, -1, null);
    }

    public BarDataException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public BarDataException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line number of the offending row, or -1 when not tied to a row.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
