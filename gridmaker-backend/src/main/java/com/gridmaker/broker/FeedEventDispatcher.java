package com.gridmaker.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single consumer of the feed's event queue. Listener failures are logged and never
 * stop the dispatcher.
 */
public class FeedEventDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FeedEventDispatcher.class);

    private static final long POLL_MILLIS = 200;

    private final BlockingQueue<FeedEvent> events;
    private final FeedListener listener;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    public FeedEventDispatcher(BlockingQueue<FeedEvent> events, FeedListener listener) {
        this.events = events;
        this.listener = listener;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::run, "feed-dispatcher");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    private void run() {
        logger.info("Feed dispatcher started");
        while (running.get()) {
            try {
                FeedEvent event = events.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    dispatch(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.info("Feed dispatcher stopped");
    }

    /**
     * Deliver one event on the calling thread.
     */
    void dispatch(FeedEvent event) {
        try {
            if (event instanceof FeedEvent.BookTickerEvent ticker) {
                listener.onBookTicker(ticker);
            } else if (event instanceof FeedEvent.DepthEvent depth) {
                listener.onDepth(depth);
            } else if (event instanceof FeedEvent.OrderFillEvent fill) {
                listener.onFill(fill);
            }
        } catch (RuntimeException e) {
            logger.error("Listener failed on {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }

    /**
     * Stop consuming; the event being handled is allowed to finish.
     */
    public void close(Duration timeout) {
        running.set(false);
        Thread t = thread;
        if (t != null) {
            try {
                t.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
