package com.gridmaker.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and gauges for the grid maker.
 *
 * Usage:
 *   var metrics = new MakerMetrics(registry, "SOL_USDC_PERP");
 *   metrics.incrementOrdersPlaced("Bid");
 */
public final class MakerMetrics {
    private static final Logger logger = LoggerFactory.getLogger(MakerMetrics.class);

    private final MeterRegistry registry;
    private final String symbol;
    private final AtomicLong openOrders = new AtomicLong();

    public MakerMetrics(MeterRegistry registry, String symbol) {
        this.registry = registry;
        this.symbol = symbol;
        registry.gauge("gridmaker.orders.open", List.of(Tag.of("symbol", symbol)), openOrders);
        logger.info("MakerMetrics initialized with {}", registry.getClass().getSimpleName());
    }

    /** In-memory registry, for tests and for runs without an exporter. */
    public static MakerMetrics inMemory(String symbol) {
        return new MakerMetrics(new SimpleMeterRegistry(), symbol);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void incrementOrdersPlaced(String side) {
        registry.counter("gridmaker.orders.placed", "symbol", symbol, "side", side).increment();
    }

    public void incrementOrdersRejected(String side, String reason) {
        registry.counter("gridmaker.orders.rejected",
            "symbol", symbol,
            "side", side,
            "reason", reason).increment();
    }

    public void incrementFeedReconnects(String cause) {
        registry.counter("gridmaker.feed.reconnects", "cause", cause).increment();
    }

    public void incrementLedgerFailures(String operation) {
        registry.counter("gridmaker.ledger.failures", "operation", operation).increment();
    }

    public void incrementRiskCloses(String reason) {
        registry.counter("gridmaker.risk.closes", "symbol", symbol, "reason", reason).increment();
    }

    public void setOpenOrders(int count) {
        openOrders.set(count);
    }

    /** Current value of a counter, 0 if it was never incremented. */
    public double count(String name, String... tags) {
        var counter = registry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }
}
