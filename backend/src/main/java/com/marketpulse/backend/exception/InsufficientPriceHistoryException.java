package com.marketpulse.backend.exception;

public class InsufficientPriceHistoryException extends RuntimeException {
    private final int available;
    private final int required;

    public InsufficientPriceHistoryException(int available, int required) {
        super("Insufficient price history: " + available + " candles, need " + required);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
