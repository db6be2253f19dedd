package com.gridmaker.bot;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridmaker.api.ExchangeException;
import com.gridmaker.api.ExchangeGateway;
import com.gridmaker.broker.FeedEvent.PriceLevel;
import com.gridmaker.broker.FeedEventDispatcher;
import com.gridmaker.broker.FeedException;
import com.gridmaker.broker.MarketDataFeed;
import com.gridmaker.config.MakerConfig;
import com.gridmaker.indicators.IndicatorEngine;
import com.gridmaker.persistence.PositionLedger;
import com.gridmaker.portfolio.AccountBalances;
import com.gridmaker.portfolio.PositionCache;
import com.gridmaker.strategy.OrderingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the worker threads of a running maker.
 *
 * <ul>
 *   <li>heartbeat timer: {@link MarketDataFeed#checkHeartbeat()}</li>
 *   <li>kline timer: rebuilds both band windows and opens the order gate once full</li>
 *   <li>control loop: sole owner of the ledger via {@link PositionCache#drainPending()},
 *       feed health checks with a doubling interval, cache warm-up</li>
 *   <li>feed dispatcher: routes stream events to the {@link OrderingEngine}</li>
 * </ul>
 */
public class TradingScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TradingScheduler.class);

    private static final Duration CONTROL_LOOP_INTERVAL = Duration.ofMillis(100);
    private static final Duration EXECUTOR_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final MakerConfig config;
    private final ExchangeGateway gateway;
    private final MarketDataFeed feed;
    private final IndicatorEngine indicators;
    private final PositionCache positions;
    private final PositionLedger ledger;
    private final OrderingEngine engine;
    private final AccountBalances balances;
    private final FeedEventDispatcher dispatcher;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch readyLatch = new CountDownLatch(1);
    private final CountDownLatch stoppedLatch = new CountDownLatch(1);
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ScheduledExecutorService timers = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "maker-timer-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final ScheduledExecutorService controlLoop = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "maker-control-loop");
        t.setDaemon(true);
        return t;
    });

    // Touched only by the control loop thread
    private long nextHealthCheckAt;
    private Duration healthCheckInterval;

    public TradingScheduler(MakerConfig config, ExchangeGateway gateway, MarketDataFeed feed,
                            IndicatorEngine indicators, PositionCache positions, PositionLedger ledger,
                            OrderingEngine engine, AccountBalances balances, Clock clock) {
        this.config = config;
        this.gateway = gateway;
        this.feed = feed;
        this.indicators = indicators;
        this.positions = positions;
        this.ledger = ledger;
        this.engine = engine;
        this.balances = balances;
        this.clock = clock;
        this.dispatcher = new FeedEventDispatcher(feed.events(), engine);
        this.healthCheckInterval = config.getWsCheckInterval();
    }

    /**
     * Bring the maker up. Blocks until the order gate is open.
     *
     * @throws FeedException if the stream cannot go live within the startup attempts
     * @throws IllegalStateException if the indicators are not ready within the startup timeout
     */
    public void start(boolean subscribePrivate) {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        String symbol = config.getSymbol();
        logger.info("🚀 Starting grid maker for {}", symbol);

        feed.subscribeBookTicker(symbol);
        feed.subscribeDepth(symbol);
        if (subscribePrivate) {
            feed.subscribeOrderUpdates(symbol);
        }
        connectFeed();

        seedOrderBook(symbol);
        logBalances();

        dispatcher.start();

        nextHealthCheckAt = clock.millis() + healthCheckInterval.toMillis();
        controlLoop.scheduleWithFixedDelay(this::controlTick,
            0, CONTROL_LOOP_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        timers.scheduleAtFixedRate(this::heartbeatTick,
            config.getHeartbeatCheckInterval().toMillis(), config.getHeartbeatCheckInterval().toMillis(),
            TimeUnit.MILLISECONDS);
        timers.scheduleAtFixedRate(this::klineTick,
            0, config.getKlineRefreshInterval().toMillis(), TimeUnit.MILLISECONDS);

        if (!awaitReady(config.getStartupTimeout())) {
            shutdown();
            throw new IllegalStateException("Indicators not ready within " + config.getStartupTimeout().toSeconds() + "s");
        }
        logger.info("✅ Grid maker running for {}", symbol);
    }

    private void connectFeed() {
        int attempts = config.getStartupConnectAttempts();
        feed.start();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (feed.awaitLive(config.getStartupTimeout())) {
                logger.info("📡 Market data feed live (attempt {}/{})", attempt, attempts);
                return;
            }
            logger.warn("Market data feed not live after attempt {}/{}", attempt, attempts);
            if (attempt < attempts) {
                feed.reconnect();
            }
        }
        shutdown();
        throw new FeedException("Unable to establish market data stream after " + attempts + " attempts");
    }

    private void seedOrderBook(String symbol) {
        try {
            JsonNode depth = gateway.getDepth(symbol);
            feed.getOrderBook().reset(levels(depth.path("bids")), levels(depth.path("asks")));
            logger.info("Order book seeded: bid {} ask {}", feed.getOrderBook().bestBid(), feed.getOrderBook().bestAsk());
        } catch (ExchangeException e) {
            logger.warn("Could not seed order book from REST, waiting for stream deltas: {}", e.getMessage());
        }
    }

    private static List<PriceLevel> levels(JsonNode side) {
        List<PriceLevel> levels = new ArrayList<>();
        for (JsonNode level : side) {
            if (level.isArray() && level.size() >= 2) {
                levels.add(new PriceLevel(level.get(0).asDouble(), level.get(1).asDouble()));
            }
        }
        return levels;
    }

    private void logBalances() {
        try {
            Double mid = feed.getOrderBook().midPrice();
            balances.totalBalance(mid != null ? mid : 0.0, true);
        } catch (ExchangeException e) {
            logger.warn("Balance query failed: {}", e.getMessage());
        }
    }

    /**
     * Wait until both band windows are full and the order gate is open.
     */
    public boolean awaitReady(Duration timeout) {
        try {
            return readyLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Workers ====================

    void heartbeatTick() {
        if (!running.get()) {
            return;
        }
        try {
            feed.checkHeartbeat();
        } catch (RuntimeException e) {
            logger.error("Heartbeat check failed", e);
        }
    }

    void klineTick() {
        if (!running.get()) {
            return;
        }
        try {
            if (indicators.refreshFromExchange(gateway, config.getSymbol())) {
                engine.openGate();
                readyLatch.countDown();
            }
        } catch (RuntimeException e) {
            logger.error("Kline refresh failed", e);
        }
    }

    void controlTick() {
        if (!running.get()) {
            return;
        }
        try {
            positions.drainPending();

            long now = clock.millis();
            if (now >= nextHealthCheckAt) {
                checkFeedHealth();
                nextHealthCheckAt = now + healthCheckInterval.toMillis();
            }

            if (positions.isStale() && positions.pendingJobs() == 0) {
                positions.requestRefresh();
            }
        } catch (RuntimeException e) {
            logger.error("Control loop iteration failed", e);
        }
    }

    /**
     * One health probe. A dead feed is reconnected and the probe interval doubles up to the
     * cap; a live feed resets it to the baseline.
     */
    void checkFeedHealth() {
        if (feed.isLive()) {
            if (!healthCheckInterval.equals(config.getWsCheckInterval())) {
                logger.info("Feed healthy again, health check interval back to {}s",
                    config.getWsCheckInterval().toSeconds());
            }
            healthCheckInterval = config.getWsCheckInterval();
            return;
        }
        Duration doubled = healthCheckInterval.multipliedBy(2);
        healthCheckInterval = doubled.compareTo(config.getWsCheckMaxInterval()) > 0
            ? config.getWsCheckMaxInterval() : doubled;
        logger.warn("⚠️ Feed is {}, reconnecting. Next health check in {}s",
            feed.getState(), healthCheckInterval.toSeconds());
        feed.reconnect();
    }

    Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    // ==================== Shutdown ====================

    /**
     * Stop order placement and workers, cancel open orders, close the stream and flush the ledger.
     */
    public void shutdown() {
        if (!running.getAndSet(false)) {
            return;
        }
        logger.info("🛑 Shutting down grid maker for {}", config.getSymbol());

        // No order may be sent after the final cancel-all
        engine.stop();
        timers.shutdown();
        controlLoop.shutdown();
        dispatcher.close();
        awaitTermination(timers, "timers");
        awaitTermination(controlLoop, "control loop");

        try {
            engine.cancelAll();
            logger.info("Cancelled all open orders for {}", config.getSymbol());
        } catch (ExchangeException e) {
            logger.error("❌ Failed to cancel open orders on shutdown: {}", e.getMessage());
        }

        feed.close();

        int drained = positions.drainPending();
        if (drained > 0) {
            logger.info("Flushed {} pending ledger jobs", drained);
        }
        ledger.close();
        stoppedLatch.countDown();
        logger.info("Grid maker shutdown complete");
    }

    /**
     * Block the caller until {@link #shutdown()} has completed.
     */
    public void awaitShutdown() throws InterruptedException {
        stoppedLatch.await();
    }

    private static void awaitTermination(ScheduledExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("{} did not stop within {}s", name, EXECUTOR_SHUTDOWN_TIMEOUT.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
