package com.gridmaker.api.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validated request model for placing orders on Backpack.
 */
public record OrderRequest(
    @NotBlank(message = "Symbol is required")
    @Pattern(regexp = "^[A-Z0-9]+(_[A-Z0-9]+)*$", message = "Symbol must look like SOL_USDC or SOL_USDC_PERP")
    String symbol,

    @NotNull(message = "Side is required")
    Side side,

    @NotNull(message = "Order type is required")
    OrderType type,

    @Positive(message = "Quantity must be positive")
    double quantity,

    @Positive(message = "Limit price must be positive when specified")
    Double price,

    @NotNull(message = "Time in force is required")
    TimeInForce timeInForce,

    boolean postOnly,
    boolean reduceOnly,
    String clientId,
    Boolean autoBorrow,
    Boolean autoLend
) {
    /** Resting maker-only limit order, as used for every ladder level. */
    public static OrderRequest postOnlyLimit(String symbol, Side side, double quantity, double price) {
        return new OrderRequest(symbol, side, OrderType.LIMIT, quantity, price,
            TimeInForce.GTC, true, false, null, null, null);
    }

    /** Immediate-or-cancel market order, used to flatten a position. */
    public static OrderRequest marketIoc(String symbol, Side side, double quantity) {
        return new OrderRequest(symbol, side, OrderType.MARKET, quantity, null,
            TimeInForce.IOC, false, false, null, null, null);
    }

    /**
     * Validate that a price is provided for LIMIT orders.
     */
    public void validateLimitOrder() {
        if (type == OrderType.LIMIT && price == null) {
            throw new IllegalArgumentException("Limit price is required for LIMIT orders");
        }
    }

    /**
     * Wire parameters in key order. Booleans are sent as lowercase strings and
     * the signature covers exactly this map.
     */
    public Map<String, String> toParams() {
        Map<String, String> params = new TreeMap<>();
        params.put("symbol", symbol);
        params.put("side", side.wireName());
        params.put("orderType", type.wireName());
        params.put("quantity", plain(quantity));
        params.put("timeInForce", timeInForce.name());
        if (price != null) {
            params.put("price", plain(price));
        }
        if (postOnly) {
            params.put("postOnly", "true");
        }
        if (reduceOnly) {
            params.put("reduceOnly", "true");
        }
        if (clientId != null && !clientId.isBlank()) {
            params.put("clientId", clientId);
        }
        if (autoBorrow != null) {
            params.put("autoBorrow", String.valueOf(autoBorrow));
            params.put("autoBorrowRepay", String.valueOf(autoBorrow));
        }
        if (autoLend != null) {
            params.put("autoLend", String.valueOf(autoLend));
            params.put("autoLendRedeem", String.valueOf(autoLend));
        }
        return params;
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
