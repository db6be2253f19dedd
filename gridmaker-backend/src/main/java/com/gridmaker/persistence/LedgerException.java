package com.gridmaker.persistence;

/**
 * Raised when the position store cannot be read or written.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
