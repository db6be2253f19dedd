package com.gridmaker.api.model;

import java.time.Instant;

/**
 * Execution reported on the account order-update stream.
 */
public record Fill(
    String orderId,
    String symbol,
    Side side,
    double price,
    double quantity,
    Instant timestamp
) {
    public Fill {
        if (quantity < 0) {
            throw new IllegalArgumentException("Fill quantity cannot be negative");
        }
        if (price < 0) {
            throw new IllegalArgumentException("Fill price cannot be negative");
        }
    }

    public double notional() {
        return price * quantity;
    }
}
