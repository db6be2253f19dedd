package com.gridmaker.strategy;

import com.gridmaker.indicators.BandSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Target position scale from where the price sits inside the long and short bands.
 * Lower in the bands means a larger scale: at or below both lower bounds the result is
 * maxScale, at or above both upper bounds it is minScale.
 */
public class PositionScaler {
    private static final Logger logger = LoggerFactory.getLogger(PositionScaler.class);

    static final double MIN_BAND_WIDTH = 1e-4;
    static final double NEUTRAL_SCALE = 1.0;

    private final double minScale;
    private final double maxScale;

    public PositionScaler(double minScale, double maxScale) {
        if (maxScale < minScale) {
            throw new IllegalArgumentException("maxScale must be >= minScale");
        }
        this.minScale = minScale;
        this.maxScale = maxScale;
    }

    public double scale(double price, BandSnapshot longBand, BandSnapshot shortBand) {
        if (!usable(longBand) || !usable(shortBand)) {
            logger.debug("Bands not ready, using neutral scale");
            return NEUTRAL_SCALE;
        }
        if (longBand.width() <= MIN_BAND_WIDTH || shortBand.width() <= MIN_BAND_WIDTH) {
            logger.debug("Band too narrow, using neutral scale");
            return NEUTRAL_SCALE;
        }

        double longPosition = 1.0 - clamp((price - longBand.lower()) / longBand.width());
        double shortPosition = 1.0 - clamp((price - shortBand.lower()) / shortBand.width());
        double average = (longPosition + shortPosition) / 2;
        double scale = minScale + (maxScale - minScale) * average;

        logger.debug("Position scale: price={} long={} short={} scale={}", price,
            String.format("%.4f", longPosition), String.format("%.4f", shortPosition), String.format("%.4f", scale));
        return scale;
    }

    private static boolean usable(BandSnapshot band) {
        return band != null && band.ready() && band.upper() != 0 && band.lower() != 0;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
