package com.marketpulse.backend.exception;

/**
 * Network failure or rate limiting on an external source. Loops retry these with backoff.
 */
public class TransientIngestException extends RuntimeException {
    private final int statusCode;

    public TransientIngestException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public TransientIngestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransientIngestException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429 || statusCode == 402;
    }
}
