package com.gridmaker.portfolio;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridmaker.api.ExchangeException;
import com.gridmaker.api.ExchangeGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Account valuation for the traded pair: spot available + locked, adjusted by
 * borrow/lend net quantities, valued in the quote asset at the last price.
 */
public class AccountBalances {
    private static final Logger logger = LoggerFactory.getLogger(AccountBalances.class);

    public record Summary(double baseBalance, double quoteBalance, double totalValueInQuote) {}

    private final ExchangeGateway gateway;
    private final String baseAsset;
    private final String quoteAsset;

    public AccountBalances(ExchangeGateway gateway, String baseAsset, String quoteAsset) {
        this.gateway = gateway;
        this.baseAsset = baseAsset;
        this.quoteAsset = quoteAsset;
    }

    /**
     * @param lastPrice price used to value the base asset; 0 values the quote side only
     */
    public Summary totalBalance(double lastPrice, boolean includeBorrowLend) {
        JsonNode balances = gateway.getBalances();

        double spotBase = spotTotal(balances.path(baseAsset));
        double spotQuote = spotTotal(balances.path(quoteAsset));

        double baseAdjustment = 0.0;
        double quoteAdjustment = 0.0;
        if (includeBorrowLend) {
            try {
                JsonNode positions = gateway.getBorrowLendPositions();
                if (positions.isArray()) {
                    for (JsonNode position : positions) {
                        String asset = position.path("symbol").asText();
                        double net = position.path("netQuantity").asDouble(0.0);
                        if (baseAsset.equals(asset)) {
                            baseAdjustment = net;
                        } else if (quoteAsset.equals(asset)) {
                            quoteAdjustment = net;
                        }
                    }
                }
            } catch (ExchangeException e) {
                logger.warn("Borrow/lend positions unavailable, valuing spot only: {}", e.getMessage());
            }
        }

        double base = spotBase + baseAdjustment;
        double quote = spotQuote + quoteAdjustment;
        double total;
        if (lastPrice > 0) {
            total = base * lastPrice + quote;
        } else {
            logger.warn("No current price, total value covers {} only", quoteAsset);
            total = quote;
        }

        logger.info("💼 {}: {} (spot {}, borrow/lend {}) | {}: {} (spot {}, borrow/lend {}) | total {} {}",
            baseAsset, fmt(base), fmt(spotBase), fmt(baseAdjustment),
            quoteAsset, fmt(quote), fmt(spotQuote), fmt(quoteAdjustment),
            fmt(total), quoteAsset);
        return new Summary(base, quote, total);
    }

    private static double spotTotal(JsonNode asset) {
        if (asset.isMissingNode() || !asset.isObject()) {
            return 0.0;
        }
        return asset.path("available").asDouble(0.0) + asset.path("locked").asDouble(0.0);
    }

    private static String fmt(double value) {
        return String.format("%.8f", value);
    }
}
