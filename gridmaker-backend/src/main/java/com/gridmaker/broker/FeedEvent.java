package com.gridmaker.broker;

import com.gridmaker.api.model.Fill;

import java.time.Instant;
import java.util.List;

/**
 * Typed events parsed from stream frames.
 */
public sealed interface FeedEvent permits FeedEvent.BookTickerEvent, FeedEvent.DepthEvent, FeedEvent.OrderFillEvent {

    String symbol();

    /** Best bid/ask update. */
    record BookTickerEvent(String symbol, double bid, double ask, Instant receivedAt) implements FeedEvent {
        public double mid() {
            return (bid + ask) / 2;
        }
    }

    /** Incremental book update; a zero quantity removes the level. */
    record DepthEvent(String symbol, List<PriceLevel> bids, List<PriceLevel> asks) implements FeedEvent {}

    record OrderFillEvent(Fill fill) implements FeedEvent {
        @Override
        public String symbol() {
            return fill.symbol();
        }
    }

    record PriceLevel(double price, double quantity) {}
}
