package com.gridmaker.api.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Working order as acknowledged by the exchange. Transient, tracked only while open.
 */
public record Order(
    String id,
    String clientId,
    String symbol,
    Side side,
    double price,
    double quantity,
    OrderType type,
    TimeInForce timeInForce,
    boolean postOnly
) {
    /**
     * Build from an order-execute or open-orders response element.
     * Returns null when the node carries no order id (rejected or empty response).
     */
    public static Order fromJson(JsonNode node) {
        if (node == null || !node.hasNonNull("id")) {
            return null;
        }
        return new Order(
            node.path("id").asText(),
            node.hasNonNull("clientId") ? node.path("clientId").asText() : null,
            node.path("symbol").asText(),
            Side.fromWire(node.path("side").asText()),
            node.path("price").asDouble(0.0),
            node.path("quantity").asDouble(0.0),
            node.hasNonNull("orderType") ? OrderType.fromWire(node.path("orderType").asText()) : OrderType.LIMIT,
            TimeInForce.fromWire(node.path("timeInForce").asText(null)),
            node.path("postOnly").asBoolean(false)
        );
    }
}
