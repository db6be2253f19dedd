package com.gridmaker.strategy;

import com.gridmaker.config.MakerConfig;
import com.gridmaker.indicators.BandSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Volatility-driven ask/bid spreads.
 *
 * Volatility is the short band width over price. It maps linearly from spreadMin (at the
 * low threshold) to spreadMax (at the high threshold). Trend skew then tightens the side
 * that follows the trend and widens the other by the same amount. Results stay within
 * [spreadMin, spreadMax].
 */
public class SpreadCalculator {
    private static final Logger logger = LoggerFactory.getLogger(SpreadCalculator.class);

    public record Spreads(double ask, double bid) {}

    private final boolean dynamic;
    private final double staticSpread;
    private final double spreadMin;
    private final double spreadMax;
    private final double lowVolatility;
    private final double highVolatility;
    private final boolean trendSkew;
    private final double uptrendSkew;
    private final double downtrendSkew;

    public SpreadCalculator(MakerConfig config) {
        this(config.isDynamicSpread(), config.getSpread(), config.getSpreadMin(), config.getSpreadMax(),
            config.getLowVolatilityThreshold(), config.getHighVolatilityThreshold(),
            config.isTrendSkew(), config.getUptrendSkew(), config.getDowntrendSkew());
    }

    public SpreadCalculator(boolean dynamic, double staticSpread, double spreadMin, double spreadMax,
                            double lowVolatility, double highVolatility,
                            boolean trendSkew, double uptrendSkew, double downtrendSkew) {
        if (spreadMax < spreadMin) {
            throw new IllegalArgumentException("spreadMax must be >= spreadMin");
        }
        if (highVolatility <= lowVolatility) {
            throw new IllegalArgumentException("High volatility threshold must exceed the low one");
        }
        this.dynamic = dynamic;
        this.staticSpread = staticSpread;
        this.spreadMin = spreadMin;
        this.spreadMax = spreadMax;
        this.lowVolatility = lowVolatility;
        this.highVolatility = highVolatility;
        this.trendSkew = trendSkew;
        this.uptrendSkew = uptrendSkew;
        this.downtrendSkew = downtrendSkew;
    }

    public Spreads spreads(double price, BandSnapshot shortBand) {
        if (!dynamic || price <= 0 || shortBand == null) {
            return new Spreads(staticSpread, staticSpread);
        }

        double base = baseSpread(Math.abs(shortBand.upper() - shortBand.lower()) / price);
        double ask = base;
        double bid = base;
        if (trendSkew) {
            double factor = price > shortBand.middle() ? uptrendSkew : downtrendSkew;
            ask = base * factor;
            bid = base * (2 - factor);
        }

        Spreads result = new Spreads(clamp(ask), clamp(bid));
        logger.debug("Spread: base={} ask={} bid={}", String.format("%.6f", base),
            String.format("%.6f", result.ask()), String.format("%.6f", result.bid()));
        return result;
    }

    /**
     * Linear map of volatility onto [spreadMin, spreadMax].
     */
    public double baseSpread(double volatility) {
        if (volatility <= lowVolatility) {
            return spreadMin;
        }
        if (volatility >= highVolatility) {
            return spreadMax;
        }
        double normalized = (volatility - lowVolatility) / (highVolatility - lowVolatility);
        return spreadMin + (spreadMax - spreadMin) * normalized;
    }

    private double clamp(double spread) {
        return Math.max(spreadMin, Math.min(spreadMax, spread));
    }
}
