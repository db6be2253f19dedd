package com.gridmaker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridmaker.api.model.Kline;
import com.gridmaker.api.model.Order;
import com.gridmaker.api.model.OrderRequest;

import java.util.List;
import java.util.Optional;

/**
 * Exchange operations consumed by the engine. Calls are synchronous; failures
 * surface as {@link ExchangeException} after the implementation's own retries.
 */
public interface ExchangeGateway {

    JsonNode getTicker(String symbol);

    JsonNode getDepth(String symbol);

    JsonNode getMarkets();

    List<Kline> getKlines(String symbol, String interval, int limit);

    /**
     * @return the acknowledged order, or empty when the exchange answered without an order id
     */
    Optional<Order> placeOrder(OrderRequest request);

    void cancelOrder(String symbol, String orderId);

    void cancelAllOrders(String symbol);

    List<Order> getOpenOrders(String symbol);

    /** Spot balances keyed by asset: {"SOL": {"available": "...", "locked": "..."}} */
    JsonNode getBalances();

    JsonNode getFillHistory(String symbol, int limit);

    JsonNode getBorrowLendPositions();
}
