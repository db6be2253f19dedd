package com.gridmaker.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gridmaker.api.RequestSigner;
import com.gridmaker.api.RetryPolicy;
import com.gridmaker.api.model.Fill;
import com.gridmaker.api.model.Side;
import com.gridmaker.broker.FeedEvent.BookTickerEvent;
import com.gridmaker.broker.FeedEvent.DepthEvent;
import com.gridmaker.broker.FeedEvent.OrderFillEvent;
import com.gridmaker.broker.FeedEvent.PriceLevel;
import com.gridmaker.metrics.MakerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Backpack market data stream.
 *
 * Lifecycle: DISCONNECTED -> CONNECTING -> AUTHENTICATING -> SUBSCRIBED -> LIVE. Every
 * (re)connect replays the full subscription set before going LIVE. Parsed frames are
 * published as {@link FeedEvent}s on a queue drained by one {@link FeedEventDispatcher}.
 *
 * Liveness: any inbound frame or pong refreshes the heartbeat. {@link #checkHeartbeat()}
 * is driven by an external timer and forces one reconnect per staleness episode.
 */
public class MarketDataFeed implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MarketDataFeed.class);

    private static final int EVENT_QUEUE_CAPACITY = 10_000;
    private static final String PRIVATE_PREFIX = "account.";

    private final WebSocketConnector connector;
    private final URI uri;
    private final RequestSigner signer;
    private final RetryPolicy retryPolicy;
    private final MakerMetrics metrics;
    private final Clock clock;
    private final Duration heartbeatTimeout;
    private final Duration pingInterval;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BlockingQueue<FeedEvent> events = new LinkedBlockingQueue<>(EVENT_QUEUE_CAPACITY);
    private final OrderBook orderBook = new OrderBook();
    private final Set<String> subscriptions = new CopyOnWriteArraySet<>();

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicReference<WebSocketConnector.Connection> connection = new AtomicReference<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean reconnectPending = new AtomicBoolean(false);
    private final AtomicBoolean staleEpisode = new AtomicBoolean(false);
    private final AtomicInteger reconnectAttempts = new AtomicInteger(0);
    private final AtomicLong generation = new AtomicLong(0);
    private final AtomicLong lastHeartbeatAt = new AtomicLong(0);

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition stateChanged = stateLock.newCondition();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "feed-ws-scheduler");
        t.setDaemon(true);
        return t;
    });

    public MarketDataFeed(WebSocketConnector connector, URI uri, RequestSigner signer, RetryPolicy retryPolicy,
                          MakerMetrics metrics, Clock clock, Duration heartbeatTimeout, Duration pingInterval) {
        this.connector = connector;
        this.uri = uri;
        this.signer = signer;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.heartbeatTimeout = heartbeatTimeout;
        this.pingInterval = pingInterval;
    }

    // ==================== Lifecycle ====================

    /**
     * Open the connection and start pinging. Returns immediately; use {@link #awaitLive(Duration)}.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        logger.info("📡 Starting market data feed {} with {} subscriptions", uri, subscriptions.size());
        scheduler.scheduleAtFixedRate(this::sendPing,
            pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
        connect();
    }

    /**
     * Block until the feed is LIVE or the timeout elapses.
     */
    public boolean awaitLive(Duration timeout) {
        long remaining = timeout.toNanos();
        stateLock.lock();
        try {
            while (state.get() != ConnectionState.LIVE) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = stateChanged.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Drop the current socket and connect again right away.
     */
    public void reconnect() {
        if (running.get()) {
            forceReconnect("manual");
        }
    }

    @Override
    public void close() {
        running.set(false);
        generation.incrementAndGet();
        scheduler.shutdownNow();
        closeConnection();
        setState(ConnectionState.DISCONNECTED);
        logger.info("🔌 Market data feed closed");
    }

    private void connect() {
        if (!running.get()) {
            return;
        }
        reconnectPending.set(false);
        long gen = generation.incrementAndGet();
        setState(ConnectionState.CONNECTING);

        connector.connect(uri, new Handler(gen)).whenComplete((conn, error) -> {
            if (error != null) {
                logger.error("❌ Connection to {} failed: {}", uri, error.getMessage());
                onDisconnected(gen, "connect failed");
                return;
            }
            if (gen != generation.get() || !running.get()) {
                conn.close();
                return;
            }
            connection.set(conn);
            onConnected(gen, conn);
        });
    }

    private void onConnected(long gen, WebSocketConnector.Connection conn) {
        lastHeartbeatAt.set(clock.millis());
        setState(ConnectionState.AUTHENTICATING);
        try {
            // Private channels carry their signature in the subscribe frame itself
            for (String channel : subscriptions) {
                sendSubscribe(conn, channel);
            }
        } catch (RuntimeException e) {
            logger.error("Subscription replay failed: {}", e.getMessage());
            closeConnection();
            onDisconnected(gen, "replay failed");
            return;
        }
        if (gen != generation.get()) {
            return;
        }
        setState(ConnectionState.SUBSCRIBED);
        staleEpisode.set(false);
        reconnectAttempts.set(0);
        setState(ConnectionState.LIVE);
        logger.info("✅ Feed live with {} subscriptions", subscriptions.size());
    }

    private void onDisconnected(long gen, String cause) {
        // Each connection reports at most once; error and close often both fire
        if (!generation.compareAndSet(gen, gen + 1)) {
            return;
        }
        connection.set(null);
        setState(ConnectionState.DISCONNECTED);
        if (running.get()) {
            scheduleReconnect(cause);
        }
    }

    private void forceReconnect(String cause) {
        long gen = generation.get();
        if (!generation.compareAndSet(gen, gen + 1)) {
            return;
        }
        closeConnection();
        setState(ConnectionState.DISCONNECTED);
        if (running.get()) {
            scheduleReconnect(cause);
        }
    }

    private void scheduleReconnect(String cause) {
        if (!reconnectPending.compareAndSet(false, true)) {
            return;
        }
        int attempt = reconnectAttempts.incrementAndGet();
        Duration delay = retryPolicy.backoffFor(attempt);
        metrics.incrementFeedReconnects(cause);
        logger.info("🔄 Reconnecting in {}ms (attempt {}, cause: {})", delay.toMillis(), attempt, cause);
        try {
            scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Reconnect not scheduled, feed is shutting down");
        }
    }

    private void closeConnection() {
        WebSocketConnector.Connection conn = connection.getAndSet(null);
        if (conn != null) {
            try {
                conn.close();
            } catch (RuntimeException e) {
                logger.debug("Error closing socket: {}", e.getMessage());
            }
        }
    }

    private void setState(ConnectionState newState) {
        ConnectionState previous = state.getAndSet(newState);
        if (previous != newState) {
            logger.debug("Feed state {} -> {}", previous, newState);
        }
        stateLock.lock();
        try {
            stateChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
    }

    // ==================== Heartbeat ====================

    /**
     * Force a reconnect if the feed is LIVE but nothing arrived within the heartbeat timeout.
     * Fires once per staleness episode; the episode ends when the feed is LIVE again.
     *
     * @return whether a reconnect was forced
     */
    public boolean checkHeartbeat() {
        if (state.get() != ConnectionState.LIVE) {
            return false;
        }
        long age = clock.millis() - lastHeartbeatAt.get();
        if (age <= heartbeatTimeout.toMillis()) {
            return false;
        }
        if (!staleEpisode.compareAndSet(false, true)) {
            return false;
        }
        logger.warn("💔 No stream traffic for {}ms (timeout {}ms), forcing reconnect", age, heartbeatTimeout.toMillis());
        forceReconnect("heartbeat");
        return true;
    }

    private void sendPing() {
        if (state.get() != ConnectionState.LIVE) {
            return;
        }
        WebSocketConnector.Connection conn = connection.get();
        if (conn != null) {
            try {
                conn.sendPing();
            } catch (RuntimeException e) {
                logger.warn("Ping failed: {}", e.getMessage());
            }
        }
    }

    // ==================== Subscriptions ====================

    /**
     * Add a channel. Re-subscribing to a known channel is a no-op.
     *
     * @return whether the channel was new
     */
    public boolean subscribe(String channel) {
        if (channel.startsWith(PRIVATE_PREFIX) && signer == null) {
            throw new FeedException("Private channel " + channel + " requires credentials");
        }
        if (!subscriptions.add(channel)) {
            return false;
        }
        ConnectionState current = state.get();
        WebSocketConnector.Connection conn = connection.get();
        if (conn != null && current != ConnectionState.DISCONNECTED && current != ConnectionState.CONNECTING) {
            try {
                sendSubscribe(conn, channel);
            } catch (RuntimeException e) {
                // Replayed on the next connect
                logger.warn("Failed to send subscribe for {}: {}", channel, e.getMessage());
            }
        }
        logger.info("📡 Subscribed to {}", channel);
        return true;
    }

    public boolean subscribeDepth(String symbol) {
        return subscribe("depth." + symbol);
    }

    public boolean subscribeBookTicker(String symbol) {
        return subscribe("bookTicker." + symbol);
    }

    public boolean subscribeOrderUpdates(String symbol) {
        return subscribe("account.orderUpdate." + symbol);
    }

    public boolean unsubscribe(String channel) {
        if (!subscriptions.remove(channel)) {
            return false;
        }
        WebSocketConnector.Connection conn = connection.get();
        if (conn != null && state.get() == ConnectionState.LIVE) {
            ObjectNode message = objectMapper.createObjectNode();
            message.put("method", "UNSUBSCRIBE");
            message.putArray("params").add(channel);
            conn.sendText(message.toString());
        }
        return true;
    }

    private void sendSubscribe(WebSocketConnector.Connection conn, String channel) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("method", "SUBSCRIBE");
        message.putArray("params").add(channel);
        if (channel.startsWith(PRIVATE_PREFIX)) {
            var signatureArray = message.putArray("signature");
            signer.streamSignature().forEach(signatureArray::add);
        }
        conn.sendText(message.toString());
    }

    // ==================== Frame parsing ====================

    private void onFrame(String message) {
        lastHeartbeatAt.set(clock.millis());
        try {
            JsonNode root = objectMapper.readTree(message);
            if (root.has("stream") && root.has("data")) {
                String stream = root.path("stream").asText();
                FeedEvent event = parseEvent(stream, root.path("data"));
                if (event != null) {
                    publish(event);
                }
            } else if (root.has("error")) {
                logger.warn("⚠️ Stream error: {}", root.get("error"));
            } else {
                logger.debug("📩 Unhandled frame: {}", message.substring(0, Math.min(200, message.length())));
            }
        } catch (Exception e) {
            logger.warn("Dropping malformed frame: {}", e.getMessage());
        }
    }

    FeedEvent parseEvent(String stream, JsonNode data) {
        if (stream.startsWith("bookTicker.")) {
            if (!data.hasNonNull("b") || !data.hasNonNull("a")) {
                logger.debug("bookTicker frame without b/a: {}", data);
                return null;
            }
            String symbol = data.path("s").asText(stream.substring("bookTicker.".length()));
            double bid = requirePositive(data.path("b").asDouble(Double.NaN), "bid");
            double ask = requirePositive(data.path("a").asDouble(Double.NaN), "ask");
            return new BookTickerEvent(symbol, bid, ask, clock.instant());
        }
        if (stream.startsWith("depth.")) {
            String symbol = data.path("s").asText(stream.substring("depth.".length()));
            DepthEvent event = new DepthEvent(symbol, levels(data.path("b")), levels(data.path("a")));
            orderBook.apply(event);
            return event;
        }
        if (stream.startsWith("account.orderUpdate.")) {
            if (!"orderFill".equals(data.path("e").asText())) {
                return null;
            }
            String symbol = data.path("s").asText(stream.substring("account.orderUpdate.".length()));
            JsonNode priceNode = data.hasNonNull("L") ? data.path("L") : data.path("p");
            Fill fill = new Fill(
                data.path("i").asText(),
                symbol,
                Side.fromWire(data.path("S").asText()),
                priceNode.asDouble(0.0),
                data.path("l").asDouble(0.0),
                clock.instant()
            );
            return new OrderFillEvent(fill);
        }
        logger.debug("Ignoring stream {}", stream);
        return null;
    }

    private static List<PriceLevel> levels(JsonNode array) {
        List<PriceLevel> levels = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode level : array) {
                double price = level.path(0).asDouble(Double.NaN);
                double qty = level.path(1).asDouble(Double.NaN);
                if (Double.isNaN(price) || Double.isNaN(qty)) {
                    throw new IllegalArgumentException("Malformed depth level " + level);
                }
                levels.add(new PriceLevel(price, qty));
            }
        }
        return levels;
    }

    private static double requirePositive(double value, String field) {
        if (Double.isNaN(value) || value <= 0) {
            throw new IllegalArgumentException("Invalid " + field + ": " + value);
        }
        return value;
    }

    private void publish(FeedEvent event) {
        if (!events.offer(event)) {
            logger.warn("Event queue full, dropping {}", event.getClass().getSimpleName());
        }
    }

    // ==================== Accessors ====================

    public BlockingQueue<FeedEvent> events() {
        return events;
    }

    public OrderBook getOrderBook() {
        return orderBook;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isLive() {
        return state.get() == ConnectionState.LIVE;
    }

    public List<String> getSubscriptions() {
        return List.copyOf(subscriptions);
    }

    public long getLastHeartbeatAt() {
        return lastHeartbeatAt.get();
    }

    /**
     * Callbacks bound to one connection attempt; stale generations are ignored.
     */
    private final class Handler implements WebSocketConnector.FrameHandler {
        private final long gen;

        private Handler(long gen) {
            this.gen = gen;
        }

        private boolean current() {
            return gen == generation.get();
        }

        @Override
        public void onText(String message) {
            if (current()) {
                onFrame(message);
            }
        }

        @Override
        public void onPong() {
            if (current()) {
                lastHeartbeatAt.set(clock.millis());
            }
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            onDisconnected(gen, "closed " + statusCode);
        }

        @Override
        public void onError(Throwable error) {
            onDisconnected(gen, "error");
        }
    }
}
