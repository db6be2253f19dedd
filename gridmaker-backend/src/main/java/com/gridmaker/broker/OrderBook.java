package com.gridmaker.broker;

import com.gridmaker.broker.FeedEvent.PriceLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Local price-level book maintained from depth deltas.
 */
public class OrderBook {
    private final NavigableMap<Double, Double> bids = new ConcurrentSkipListMap<>(Collections.reverseOrder());
    private final NavigableMap<Double, Double> asks = new ConcurrentSkipListMap<>();

    /**
     * Apply deltas: quantity 0 removes the level, anything else replaces it.
     */
    public void apply(FeedEvent.DepthEvent event) {
        applySide(bids, event.bids());
        applySide(asks, event.asks());
    }

    /**
     * Replace the whole book, e.g. from a REST depth snapshot.
     */
    public void reset(List<PriceLevel> bidLevels, List<PriceLevel> askLevels) {
        bids.clear();
        asks.clear();
        applySide(bids, bidLevels);
        applySide(asks, askLevels);
    }

    private static void applySide(NavigableMap<Double, Double> side, List<PriceLevel> levels) {
        for (PriceLevel level : levels) {
            if (level.quantity() == 0.0) {
                side.remove(level.price());
            } else {
                side.put(level.price(), level.quantity());
            }
        }
    }

    public Double bestBid() {
        Map.Entry<Double, Double> entry = bids.firstEntry();
        return entry != null ? entry.getKey() : null;
    }

    public Double bestAsk() {
        Map.Entry<Double, Double> entry = asks.firstEntry();
        return entry != null ? entry.getKey() : null;
    }

    /** Mid price, or null while either side is empty. */
    public Double midPrice() {
        Double bid = bestBid();
        Double ask = bestAsk();
        return bid != null && ask != null ? (bid + ask) / 2 : null;
    }

    public List<PriceLevel> bids() {
        return levels(bids);
    }

    public List<PriceLevel> asks() {
        return levels(asks);
    }

    private static List<PriceLevel> levels(NavigableMap<Double, Double> side) {
        List<PriceLevel> result = new ArrayList<>(side.size());
        side.forEach((price, qty) -> result.add(new PriceLevel(price, qty)));
        return result;
    }
}
