package com.gridmaker.persistence;

import java.time.Instant;

/**
 * Net position and cost basis for one instrument. Size and cost are never negative.
 */
public record Position(String symbol, double size, double cost, Instant updatedAt) {

    public Position {
        size = Math.max(0.0, size);
        cost = Math.max(0.0, cost);
    }

    public static Position empty(String symbol) {
        return new Position(symbol, 0.0, 0.0, Instant.EPOCH);
    }

    /** Weighted-average entry price, 0 when flat. */
    public double averagePrice() {
        return size > 0 ? cost / size : 0.0;
    }

    public boolean isFlat() {
        return size <= 0;
    }
}
