package com.gridmaker.risk;

import com.gridmaker.api.ExchangeException;
import com.gridmaker.api.ExchangeGateway;
import com.gridmaker.api.model.OrderRequest;
import com.gridmaker.api.model.Side;
import com.gridmaker.config.MakerConfig;
import com.gridmaker.metrics.MakerMetrics;
import com.gridmaker.persistence.Position;
import com.gridmaker.portfolio.PositionCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stop-loss and take-profit against the position's cost basis.
 *
 * roi = (price - cost) / cost. A loss of at least the stop-loss ratio flattens the position
 * once |roi| has also reached the activation threshold; a gain of at least the take-profit
 * ratio flattens it regardless of activation. Closing is one IOC market sell.
 */
public class RiskControl {
    private static final Logger logger = LoggerFactory.getLogger(RiskControl.class);

    public enum Action {
        NONE,
        STOP_LOSS,
        TAKE_PROFIT
    }

    private final String symbol;
    private final double stopLossActivation;
    private final double stopLossRatio;
    private final double takeProfitRatio;
    private final int quantityPrecision;
    private final ExchangeGateway gateway;
    private final PositionCache positions;
    private final MakerMetrics metrics;

    public RiskControl(MakerConfig config, ExchangeGateway gateway, PositionCache positions, MakerMetrics metrics) {
        this.symbol = config.getSymbol();
        this.stopLossActivation = config.getStopLossActivation();
        this.stopLossRatio = config.getStopLossRatio();
        this.takeProfitRatio = config.getTakeProfitRatio();
        this.quantityPrecision = config.getQuantityPrecision();
        this.gateway = gateway;
        this.positions = positions;
        this.metrics = metrics;
    }

    /**
     * Pure decision for the given price and cost basis.
     */
    public Action evaluate(double price, double cost) {
        if (cost <= 0) {
            return Action.NONE;
        }
        double roi = (price - cost) / cost;
        if (Math.abs(roi) >= stopLossActivation && roi < 0 && Math.abs(roi) >= stopLossRatio) {
            return Action.STOP_LOSS;
        }
        if (roi >= takeProfitRatio) {
            return Action.TAKE_PROFIT;
        }
        return Action.NONE;
    }

    /**
     * Evaluate and close the position if a threshold is hit.
     *
     * @return true when trading may continue this cycle, false after a close
     */
    public boolean check(double price, double cost) {
        Action action = evaluate(price, cost);
        if (action == Action.NONE) {
            return true;
        }
        double roi = (price - cost) / cost;
        logger.warn("🛑 {} triggered: roi={}%, price={}, cost={}",
            action, String.format("%.2f", roi * 100), price, cost);
        closePosition(action);
        return false;
    }

    /**
     * Market-sell the full cached size. No order is sent when the position is flat.
     */
    public void closePosition(Action reason) {
        Position position = positions.getCachedPosition();
        double size = round(position.size());
        if (size <= 0) {
            logger.info("No position to close for {}", symbol);
            return;
        }
        metrics.incrementRiskCloses(reason.name().toLowerCase());
        try {
            gateway.placeOrder(OrderRequest.marketIoc(symbol, Side.ASK, size))
                .ifPresentOrElse(
                    order -> logger.info("✅ Position closed at market: {} {} (order {})", size, symbol, order.id()),
                    () -> logger.warn("Close order for {} {} was not acknowledged", size, symbol));
        } catch (ExchangeException | IllegalArgumentException e) {
            logger.error("❌ Failed to close position of {} {}: {}", size, symbol, e.getMessage());
        }
    }

    private double round(double value) {
        double factor = Math.pow(10, quantityPrecision);
        return Math.floor(value * factor + 1e-9) / factor;
    }
}
