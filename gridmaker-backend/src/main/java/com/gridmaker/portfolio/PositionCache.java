package com.gridmaker.portfolio;

import com.gridmaker.api.model.Fill;
import com.gridmaker.metrics.MakerMetrics;
import com.gridmaker.persistence.LedgerException;
import com.gridmaker.persistence.Position;
import com.gridmaker.persistence.PositionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Read-through cache in front of {@link PositionLedger}.
 *
 * The ledger is touched only by the thread that calls {@link #drainPending()} (the
 * scheduler control loop). Everyone else talks to it through a FIFO job queue: fills
 * are enqueued fire-and-forget, and reads post a refresh request and wait a bounded
 * time for its reply. Reads can therefore lag the ledger by up to the refresh interval.
 */
public class PositionCache {
    private static final Logger logger = LoggerFactory.getLogger(PositionCache.class);

    /** Work items processed by the owner in arrival order. */
    public sealed interface Job permits UpdatePosition, RefreshPosition {}

    public record UpdatePosition(Fill fill) implements Job {}

    public record RefreshPosition(CompletableFuture<Position> reply) implements Job {}

    private record Cached(Position position, Instant cachedAt) {}

    private final PositionLedger ledger;
    private final String symbol;
    private final Duration refreshInterval;
    private final Duration readTimeout;
    private final MakerMetrics metrics;
    private final Clock clock;

    private final BlockingQueue<Job> queue = new LinkedBlockingQueue<>();
    private volatile Cached cached;
    private volatile Thread owner;

    public PositionCache(PositionLedger ledger, String symbol, Duration refreshInterval,
                         Duration readTimeout, MakerMetrics metrics) {
        this(ledger, symbol, refreshInterval, readTimeout, metrics, Clock.systemUTC());
    }

    public PositionCache(PositionLedger ledger, String symbol, Duration refreshInterval,
                         Duration readTimeout, MakerMetrics metrics, Clock clock) {
        this.ledger = ledger;
        this.symbol = symbol;
        this.refreshInterval = refreshInterval;
        this.readTimeout = readTimeout;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Queue a fill for the ledger. Never blocks.
     */
    public void enqueueFill(Fill fill) {
        queue.offer(new UpdatePosition(fill));
        logger.debug("Queued {} fill {} x {} @ {}", fill.side(), fill.orderId(), fill.quantity(), fill.price());
    }

    /**
     * Queue a refresh without waiting for it, used to keep the cache warm.
     */
    public CompletableFuture<Position> requestRefresh() {
        var reply = new CompletableFuture<Position>();
        queue.offer(new RefreshPosition(reply));
        return reply;
    }

    /**
     * Process every queued job without blocking. Must only be called by the owning worker.
     *
     * @return number of jobs processed
     */
    public int drainPending() {
        owner = Thread.currentThread();
        int processed = 0;
        Job job;
        while ((job = queue.poll()) != null) {
            process(job);
            processed++;
        }
        return processed;
    }

    private void process(Job job) {
        if (job instanceof UpdatePosition update) {
            try {
                Position position = ledger.applyFill(update.fill());
                cached = new Cached(position, clock.instant());
            } catch (LedgerException e) {
                // Cache keeps the previous value until a later refresh succeeds
                logger.error("Ledger write failed for fill {}: {}", update.fill().orderId(), e.getMessage());
                metrics.incrementLedgerFailures("applyFill");
            }
        } else if (job instanceof RefreshPosition refresh) {
            try {
                Position position = ledger.getPosition(symbol);
                cached = new Cached(position, clock.instant());
                refresh.reply().complete(position);
            } catch (LedgerException e) {
                logger.error("Ledger read failed for {}: {}", symbol, e.getMessage());
                metrics.incrementLedgerFailures("getPosition");
                refresh.reply().completeExceptionally(e);
            }
        }
    }

    /**
     * Cached position, refreshed through the owner when missing or older than the refresh
     * interval. Waits at most the read timeout, then falls back to the last known value or
     * an empty position.
     */
    public Position getCachedPosition() {
        Cached current = cached;
        if (current != null && !isStale(current)) {
            return current.position();
        }

        CompletableFuture<Position> reply = requestRefresh();
        if (Thread.currentThread() == owner) {
            drainPending();
        }
        try {
            return reply.get(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Position refresh timed out after {}ms, serving last known value", readTimeout.toMillis());
        } catch (ExecutionException e) {
            logger.warn("Position refresh failed, serving last known value: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Cached fallback = cached;
        return fallback != null ? fallback.position() : Position.empty(symbol);
    }

    public boolean isStale() {
        Cached current = cached;
        return current == null || isStale(current);
    }

    private boolean isStale(Cached current) {
        return Duration.between(current.cachedAt(), clock.instant()).compareTo(refreshInterval) > 0;
    }

    public int pendingJobs() {
        return queue.size();
    }

    public String getSymbol() {
        return symbol;
    }
}
