package com.gridmaker.strategy;

import com.gridmaker.api.ExchangeException;
import com.gridmaker.api.ExchangeGateway;
import com.gridmaker.api.model.Order;
import com.gridmaker.api.model.OrderRequest;
import com.gridmaker.api.model.Side;
import com.gridmaker.broker.FeedEvent;
import com.gridmaker.broker.FeedListener;
import com.gridmaker.config.MakerConfig;
import com.gridmaker.indicators.IndicatorEngine;
import com.gridmaker.metrics.MakerMetrics;
import com.gridmaker.persistence.Position;
import com.gridmaker.portfolio.PositionCache;
import com.gridmaker.risk.RiskControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Strategy core. On a qualifying book ticker it runs one cycle:
 * risk check, band snapshot, position scale, dynamic spread, then a fresh ladder.
 * Fills from the account stream go to the {@link PositionCache}.
 *
 * Cycles are throttled to one per order interval and deferred until the indicator
 * gate is open. Runs on the feed dispatcher thread.
 *
 * Placement and cancel-all never interleave. Once {@link #stop()} is called no further
 * order is sent, so a cancel-all issued after it leaves nothing resting.
 */
public class OrderingEngine implements FeedListener {
    private static final Logger logger = LoggerFactory.getLogger(OrderingEngine.class);

    public enum Outcome {
        NOT_READY,
        RISK_CLOSED,
        PLACED,
        FAILED,
        STOPPED
    }

    /** Summary of one cycle. */
    public record CycleResult(
        Outcome outcome,
        double price,
        double scale,
        SpreadCalculator.Spreads spreads,
        int buysPlaced,
        int sellsPlaced,
        double buyNotionalUsed,
        double sellQuantityUsed
    ) {
        static CycleResult of(Outcome outcome, double price) {
            return new CycleResult(outcome, price, 0.0, null, 0, 0, 0.0, 0.0);
        }
    }

    private final String symbol;
    private final Duration orderInterval;
    private final ExchangeGateway gateway;
    private final IndicatorEngine indicators;
    private final PositionCache positions;
    private final RiskControl riskControl;
    private final PositionScaler scaler;
    private final SpreadCalculator spreadCalculator;
    private final GridLadderBuilder ladderBuilder;
    private final MakerMetrics metrics;
    private final Clock clock;

    private final Set<String> openOrders = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean readyGate = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final ReentrantLock placementLock = new ReentrantLock();
    private final AtomicLong lastCycleAt = new AtomicLong(Long.MIN_VALUE);
    private volatile double lastPrice;

    public OrderingEngine(MakerConfig config, ExchangeGateway gateway, IndicatorEngine indicators,
                          PositionCache positions, RiskControl riskControl, MakerMetrics metrics, Clock clock) {
        this(config.getSymbol(), config.getOrderInterval(), gateway, indicators, positions, riskControl,
            new PositionScaler(config.getMinPositionScale(), config.getMaxPositionScale()),
            new SpreadCalculator(config), new GridLadderBuilder(config), metrics, clock);
    }

    public OrderingEngine(String symbol, Duration orderInterval, ExchangeGateway gateway,
                          IndicatorEngine indicators, PositionCache positions, RiskControl riskControl,
                          PositionScaler scaler, SpreadCalculator spreadCalculator,
                          GridLadderBuilder ladderBuilder, MakerMetrics metrics, Clock clock) {
        this.symbol = symbol;
        this.orderInterval = orderInterval;
        this.gateway = gateway;
        this.indicators = indicators;
        this.positions = positions;
        this.riskControl = riskControl;
        this.scaler = scaler;
        this.spreadCalculator = spreadCalculator;
        this.ladderBuilder = ladderBuilder;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ==================== Feed events ====================

    @Override
    public void onBookTicker(FeedEvent.BookTickerEvent event) {
        if (!symbol.equals(event.symbol())) {
            return;
        }
        double price = event.mid();
        lastPrice = price;

        long now = clock.millis();
        long last = lastCycleAt.get();
        if (last != Long.MIN_VALUE && now - last < orderInterval.toMillis()) {
            return;
        }
        if (!readyGate.get()) {
            logger.debug("Waiting for kline data before placing orders");
            return;
        }
        if (!lastCycleAt.compareAndSet(last, now)) {
            return;
        }

        Position position = positions.getCachedPosition();
        adjustOrders(price, position.averagePrice());
    }

    @Override
    public void onFill(FeedEvent.OrderFillEvent event) {
        var fill = event.fill();
        logger.info("💰 Fill {} {} {} @ {} (order {})",
            fill.side(), fill.quantity(), fill.symbol(), fill.price(), fill.orderId());
        positions.enqueueFill(fill);
    }

    // ==================== Cycle ====================

    /**
     * One full decision cycle at the given price and cost basis (average entry price).
     */
    public CycleResult adjustOrders(double price, double positionCost) {
        if (stopped.get()) {
            return CycleResult.of(Outcome.STOPPED, price);
        }
        try {
            if (!riskControl.check(price, positionCost)) {
                return CycleResult.of(Outcome.RISK_CLOSED, price);
            }

            IndicatorEngine.Bands bands = indicators.snapshot();
            if (!bands.ready()) {
                logger.info("Bands not ready, deferring order placement");
                return CycleResult.of(Outcome.NOT_READY, price);
            }

            double scale = scaler.scale(price, bands.longBand(), bands.shortBand());
            SpreadCalculator.Spreads spreads = spreadCalculator.spreads(price, bands.shortBand());

            cancelAll();

            GridLadderBuilder.Ladder ladder = ladderBuilder.build(price, positionCost, bands.shortBand());
            int buys = 0;
            int sells = 0;
            double usedNotional = 0.0;
            double usedQuantity = 0.0;
            double qty = ladder.quantity();

            if (ladder.canBuy() && qty > 0) {
                for (double buyPrice : ladder.buyPrices()) {
                    if (stopped.get()) {
                        break;
                    }
                    double notional = buyPrice * qty;
                    if (usedNotional + notional > ladder.buyCap()) {
                        break;
                    }
                    if (place(Side.BID, qty, buyPrice)) {
                        usedNotional += notional;
                        buys++;
                    }
                }
            }

            if (ladder.canSell() && qty > 0) {
                for (double sellPrice : ladder.sellPrices()) {
                    if (stopped.get()) {
                        break;
                    }
                    if (usedQuantity + qty > ladder.sellCap()) {
                        break;
                    }
                    if (place(Side.ASK, qty, sellPrice)) {
                        usedQuantity += qty;
                        sells++;
                    }
                }
            }

            metrics.setOpenOrders(openOrders.size());
            logger.info("📊 Cycle @ {}: scale={} spread ask={} bid={} | {} buys ({}/{} quote) {} sells ({}/{} base)",
                price, String.format("%.2f", scale),
                String.format("%.5f", spreads.ask()), String.format("%.5f", spreads.bid()),
                buys, String.format("%.2f", usedNotional), String.format("%.2f", ladder.buyCap()),
                sells, String.format("%.4f", usedQuantity), String.format("%.4f", ladder.sellCap()));

            return new CycleResult(Outcome.PLACED, price, scale, spreads, buys, sells, usedNotional, usedQuantity);
        } catch (RuntimeException e) {
            logger.error("❌ Order cycle failed at {}: {}", price, e.getMessage(), e);
            return CycleResult.of(Outcome.FAILED, price);
        }
    }

    /**
     * Submit one post-only GTC level.
     *
     * @return true when the exchange acknowledged the order with an id
     */
    private boolean place(Side side, double quantity, double price) {
        placementLock.lock();
        try {
            if (stopped.get()) {
                return false;
            }
            Optional<Order> order = gateway.placeOrder(OrderRequest.postOnlyLimit(symbol, side, quantity, price));
            if (order.isPresent()) {
                openOrders.add(order.get().id());
                metrics.incrementOrdersPlaced(side.wireName());
                logger.debug("Placed {} {} @ {} (order {})", side, quantity, price, order.get().id());
                return true;
            }
            metrics.incrementOrdersRejected(side.wireName(), "no_id");
            logger.warn("{} {} @ {} not acknowledged", side, quantity, price);
        } catch (ExchangeException e) {
            metrics.incrementOrdersRejected(side.wireName(), String.valueOf(e.getStatusCode()));
            logger.error("❌ {} @ {} rejected: {}", side, price, e.getMessage());
        } catch (IllegalArgumentException e) {
            metrics.incrementOrdersRejected(side.wireName(), "invalid");
            logger.error("❌ {} @ {} invalid: {}", side, price, e.getMessage());
        } finally {
            placementLock.unlock();
        }
        return false;
    }

    /**
     * Cancel every open order on the symbol and forget the tracked ids.
     */
    public void cancelAll() {
        placementLock.lock();
        try {
            gateway.cancelAllOrders(symbol);
            openOrders.clear();
            metrics.setOpenOrders(0);
        } finally {
            placementLock.unlock();
        }
    }

    /**
     * Refuse every later cycle and placement. Waits for an order already in flight.
     */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            readyGate.set(false);
            placementLock.lock();
            placementLock.unlock();
            logger.info("🛑 Order placement stopped for {}", symbol);
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    // ==================== Gate & state ====================

    /** Allow cycles to run; opened once both band windows are full. */
    public void openGate() {
        if (!stopped.get() && readyGate.compareAndSet(false, true)) {
            logger.info("✅ Indicators ready, order placement enabled");
        }
    }

    public boolean isGateOpen() {
        return readyGate.get();
    }

    public Set<String> openOrders() {
        return Set.copyOf(openOrders);
    }

    public double getLastPrice() {
        return lastPrice;
    }
}
