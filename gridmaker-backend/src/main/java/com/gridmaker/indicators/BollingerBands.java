package com.gridmaker.indicators;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;

/**
 * Rolling Bollinger band over the most recent {@code period} closes.
 * middle = mean, upper/lower = middle +/- numStd * population standard deviation.
 *
 * Not thread-safe; {@link IndicatorEngine} guards access.
 */
public class BollingerBands {
    private final int period;
    private final double numStd;
    private final Deque<Double> window;

    public BollingerBands(int period, double numStd) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        if (numStd < 0) {
            throw new IllegalArgumentException("Std multiplier cannot be negative: " + numStd);
        }
        this.period = period;
        this.numStd = numStd;
        this.window = new ArrayDeque<>(period + 1);
    }

    /**
     * Append a sample, evicting the oldest once the window exceeds the period.
     */
    public void update(double price) {
        window.addLast(price);
        if (window.size() > period) {
            window.removeFirst();
        }
    }

    /**
     * Replace the window wholesale with the last {@code period} values of closes.
     */
    public void reset(Collection<Double> closes) {
        window.clear();
        closes.forEach(this::update);
    }

    public boolean isReady() {
        return window.size() >= period;
    }

    public int size() {
        return window.size();
    }

    public int getPeriod() {
        return period;
    }

    public double sma() {
        if (window.isEmpty()) {
            return 0.0;
        }
        // Shifted by the oldest sample so identical closes give an exact mean
        double ref = window.peekFirst();
        double sum = 0.0;
        for (double v : window) {
            sum += v - ref;
        }
        return ref + sum / window.size();
    }

    /**
     * Current bands. Before the window is full every line echoes the last price.
     */
    public BandSnapshot bands() {
        if (window.isEmpty()) {
            return BandSnapshot.notReady(0.0);
        }
        if (!isReady()) {
            return BandSnapshot.notReady(window.peekLast());
        }

        double mean = sma();
        double variance = 0.0;
        for (double v : window) {
            double d = v - mean;
            variance += d * d;
        }
        double std = Math.sqrt(variance / window.size());
        return new BandSnapshot(mean + numStd * std, mean, mean - numStd * std, true);
    }

    public boolean isPriceInBand(double price) {
        return bands().contains(price);
    }
}
