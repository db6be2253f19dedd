package com.gridmaker.broker;

/**
 * Consumer of feed events. Called from the single dispatcher thread only.
 */
public interface FeedListener {

    default void onBookTicker(FeedEvent.BookTickerEvent event) {
    }

    default void onDepth(FeedEvent.DepthEvent event) {
    }

    default void onFill(FeedEvent.OrderFillEvent event) {
    }
}
