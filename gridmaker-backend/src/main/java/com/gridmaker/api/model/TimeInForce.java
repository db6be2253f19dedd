package com.gridmaker.api.model;

/**
 * GTC rests until cancelled, IOC fills what it can immediately and cancels the rest.
 */
public enum TimeInForce {
    GTC,
    IOC,
    FOK;

    public static TimeInForce fromWire(String value) {
        return value == null || value.isBlank() ? GTC : valueOf(value.trim().toUpperCase());
    }
}
