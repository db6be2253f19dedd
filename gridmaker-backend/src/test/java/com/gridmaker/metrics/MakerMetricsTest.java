package com.gridmaker.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MakerMetrics Tests")
class MakerMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MakerMetrics metrics = new MakerMetrics(registry, "SOL_USDC");

    @Test
    @DisplayName("Counters should be tagged by side and reason")
    void taggedCounters() {
        metrics.incrementOrdersPlaced("Bid");
        metrics.incrementOrdersPlaced("Bid");
        metrics.incrementOrdersPlaced("Ask");
        metrics.incrementOrdersRejected("Ask", "400");

        assertEquals(2.0, metrics.count("gridmaker.orders.placed", "side", "Bid"));
        assertEquals(1.0, metrics.count("gridmaker.orders.placed", "side", "Ask"));
        assertEquals(1.0, metrics.count("gridmaker.orders.rejected", "symbol", "SOL_USDC", "reason", "400"));
    }

    @Test
    @DisplayName("Unknown counters should read as zero")
    void missingCounterIsZero() {
        assertEquals(0.0, metrics.count("gridmaker.feed.reconnects", "cause", "heartbeat"));
    }

    @Test
    @DisplayName("Open orders gauge should follow the last value set")
    void openOrdersGauge() {
        metrics.setOpenOrders(4);
        assertEquals(4.0, registry.get("gridmaker.orders.open").tag("symbol", "SOL_USDC").gauge().value());

        metrics.setOpenOrders(0);
        assertEquals(0.0, registry.get("gridmaker.orders.open").gauge().value());
    }
}
