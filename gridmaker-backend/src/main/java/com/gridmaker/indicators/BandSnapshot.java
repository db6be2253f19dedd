package com.gridmaker.indicators;

/**
 * Immutable Bollinger triple. {@code ready} is false until the window holds a full period.
 */
public record BandSnapshot(double upper, double middle, double lower, boolean ready) {

    public static BandSnapshot notReady(double price) {
        return new BandSnapshot(price, price, price, false);
    }

    public double width() {
        return upper - lower;
    }

    public boolean contains(double price) {
        return lower <= price && price <= upper;
    }
}
