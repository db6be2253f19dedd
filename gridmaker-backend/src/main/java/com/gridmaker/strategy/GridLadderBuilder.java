package com.gridmaker.strategy;

import com.gridmaker.config.MakerConfig;
import com.gridmaker.indicators.BandSnapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the candidate price levels for one ladder cycle.
 *
 * Level i (1..L) sits at price * (1 -/+ step * i), rounded to the price precision.
 * Side caps come from the total investment: the buy cap is quote notional, the sell
 * cap is base quantity at the current price. Placement against the caps happens in
 * {@link OrderingEngine} because only acknowledged orders consume budget.
 */
public class GridLadderBuilder {

    /** Candidate prices for both sides, nearest first, with the side caps. */
    public record Ladder(
        List<Double> buyPrices,
        List<Double> sellPrices,
        double quantity,
        double buyCap,
        double sellCap,
        boolean canBuy,
        boolean canSell
    ) {}

    private final int levels;
    private final double step;
    private final int pricePrecision;
    private final int quantityPrecision;
    private final double totalInvestment;
    private final double sideBudgetRatio;
    private final double baseOrderSize;
    private final double minProfitSpread;
    private final boolean tradeInBand;
    private final boolean buyBelowSma;

    public GridLadderBuilder(MakerConfig config) {
        this(config.getGridLevelsPerSide(), config.getGridStep(), config.getPricePrecision(),
            config.getQuantityPrecision(), config.getTotalInvestment(), config.getGridSideBudgetRatio(),
            config.getBaseOrderSize(), config.getMinProfitSpread(), config.isTradeInBand(), config.isBuyBelowSma());
    }

    public GridLadderBuilder(int levels, double step, int pricePrecision, int quantityPrecision,
                             double totalInvestment, double sideBudgetRatio, double baseOrderSize,
                             double minProfitSpread, boolean tradeInBand, boolean buyBelowSma) {
        this.levels = levels;
        this.step = step;
        this.pricePrecision = pricePrecision;
        this.quantityPrecision = quantityPrecision;
        this.totalInvestment = totalInvestment;
        this.sideBudgetRatio = sideBudgetRatio;
        this.baseOrderSize = baseOrderSize;
        this.minProfitSpread = minProfitSpread;
        this.tradeInBand = tradeInBand;
        this.buyBelowSma = buyBelowSma;
    }

    /**
     * @param price      reference (mid) price
     * @param positionCost average entry price, 0 when flat
     * @param shortBand  short-horizon band used for entry gating
     */
    public Ladder build(double price, double positionCost, BandSnapshot shortBand) {
        boolean canBuy = true;
        boolean canSell = true;
        if (tradeInBand) {
            boolean inBand = shortBand != null && shortBand.contains(price);
            canBuy = inBand;
            canSell = inBand;
        }
        if (buyBelowSma) {
            canBuy = canBuy && shortBand != null && price < shortBand.middle();
        }

        Double minSellPrice = positionCost > 0 ? roundPrice(positionCost * (1 + minProfitSpread)) : null;

        List<Double> buyPrices = new ArrayList<>(levels);
        List<Double> sellPrices = new ArrayList<>(levels);
        for (int i = 1; i <= levels; i++) {
            double bid = roundPrice(price * (1 - step * i));
            double ask = roundPrice(price * (1 + step * i));
            if (bid > 0) {
                buyPrices.add(bid);
            }
            // Selling at or below cost plus the minimum profit is never worth it
            if (ask > 0 && (minSellPrice == null || ask > minSellPrice)) {
                sellPrices.add(ask);
            }
        }

        double budget = totalInvestment * sideBudgetRatio;
        return new Ladder(
            List.copyOf(buyPrices),
            List.copyOf(sellPrices),
            roundQuantity(baseOrderSize),
            budget,
            price > 0 ? budget / price : 0.0,
            canBuy,
            canSell
        );
    }

    public double roundPrice(double value) {
        return BigDecimal.valueOf(value).setScale(pricePrecision, RoundingMode.HALF_UP).doubleValue();
    }

    public double roundQuantity(double value) {
        return BigDecimal.valueOf(value).setScale(quantityPrecision, RoundingMode.HALF_UP).doubleValue();
    }
}
