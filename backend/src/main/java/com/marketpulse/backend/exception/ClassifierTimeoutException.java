package com.marketpulse.backend.exception;

public class ClassifierTimeoutException extends RuntimeException {

    public ClassifierTimeoutException(String message) {
        super(message);
    }

    public ClassifierTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
