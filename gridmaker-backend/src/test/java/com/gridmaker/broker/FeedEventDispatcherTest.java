package com.gridmaker.broker;

import com.gridmaker.api.model.Fill;
import com.gridmaker.api.model.Side;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FeedEventDispatcher Tests")
class FeedEventDispatcherTest {

    private final BlockingQueue<FeedEvent> queue = new LinkedBlockingQueue<>();

    @Test
    @DisplayName("Should route each event type to its callback in queue order")
    void routesInOrder() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);
        FeedListener listener = new FeedListener() {
            @Override
            public void onBookTicker(FeedEvent.BookTickerEvent event) {
                seen.add("ticker");
                done.countDown();
            }

            @Override
            public void onDepth(FeedEvent.DepthEvent event) {
                seen.add("depth");
                done.countDown();
            }

            @Override
            public void onFill(FeedEvent.OrderFillEvent event) {
                seen.add("fill");
                done.countDown();
            }
        };
        var dispatcher = new FeedEventDispatcher(queue, listener);

        queue.add(new FeedEvent.DepthEvent("SOL_USDC", List.of(), List.of()));
        queue.add(new FeedEvent.BookTickerEvent("SOL_USDC", 100.0, 101.0, Instant.EPOCH));
        queue.add(new FeedEvent.OrderFillEvent(new Fill("1", "SOL_USDC", Side.BID, 100.0, 1.0, Instant.EPOCH)));
        dispatcher.start();

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        dispatcher.close(Duration.ofSeconds(1));

        assertThat(seen).containsExactly("depth", "ticker", "fill");
        assertThat(dispatcher.isRunning()).isFalse();
    }

    @Test
    @DisplayName("A failing listener should not stop later events")
    void listenerFailureIsContained() {
        List<Double> mids = new CopyOnWriteArrayList<>();
        var dispatcher = new FeedEventDispatcher(queue, new FeedListener() {
            @Override
            public void onBookTicker(FeedEvent.BookTickerEvent event) {
                if (event.bid() < 0.5) {
                    throw new IllegalStateException("boom");
                }
                mids.add(event.mid());
            }
        });

        dispatcher.dispatch(new FeedEvent.BookTickerEvent("SOL_USDC", 0.1, 0.2, Instant.EPOCH));
        dispatcher.dispatch(new FeedEvent.BookTickerEvent("SOL_USDC", 100.0, 102.0, Instant.EPOCH));

        assertThat(mids).containsExactly(101.0);
    }
}
