package com.gridmaker.api;

/**
 * Exchange call failure. Status 0 means the request never got an HTTP response.
 */
public class ExchangeException extends RuntimeException {
    /** Pseudo status for a call abandoned because the calling thread was interrupted. */
    public static final int INTERRUPTED = -1;

    private final int statusCode;

    public ExchangeException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isTransportError() {
        return statusCode == 0;
    }

    public boolean isRetryable() {
        return statusCode != INTERRUPTED;
    }
}
