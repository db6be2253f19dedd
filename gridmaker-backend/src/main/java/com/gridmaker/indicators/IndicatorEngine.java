package com.gridmaker.indicators;

import com.gridmaker.api.ExchangeGateway;
import com.gridmaker.api.model.Kline;
import com.gridmaker.config.MakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the long and short Bollinger windows.
 *
 * Kline refreshes rebuild both windows wholesale. Readers get a consistent
 * {@link Bands} pair taken under one short critical section and compute outside it.
 */
public class IndicatorEngine {
    private static final Logger logger = LoggerFactory.getLogger(IndicatorEngine.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final BollingerBands longBands;
    private final BollingerBands shortBands;
    private final String longInterval;
    private final String shortInterval;

    /**
     * Long and short band pair read atomically.
     */
    public record Bands(BandSnapshot longBand, BandSnapshot shortBand) {
        public boolean ready() {
            return longBand.ready() && shortBand.ready();
        }

        /** Short-horizon middle line, used for trend detection. */
        public double shortSma() {
            return shortBand.middle();
        }
    }

    public IndicatorEngine(MakerConfig config) {
        this(config.getLongBollPeriod(), config.getLongBollStd(), config.getLongBollInterval(),
            config.getShortBollPeriod(), config.getShortBollStd(), config.getShortBollInterval());
    }

    public IndicatorEngine(int longPeriod, double longStd, String longInterval,
                           int shortPeriod, double shortStd, String shortInterval) {
        this.longBands = new BollingerBands(longPeriod, longStd);
        this.shortBands = new BollingerBands(shortPeriod, shortStd);
        this.longInterval = longInterval;
        this.shortInterval = shortInterval;
    }

    /**
     * Rebuild both windows from closes; only the last {@code period} values of each list are kept.
     */
    public void refresh(List<Double> longCloses, List<Double> shortCloses) {
        lock.lock();
        try {
            longBands.reset(tail(longCloses, longBands.getPeriod()));
            shortBands.reset(tail(shortCloses, shortBands.getPeriod()));
        } finally {
            lock.unlock();
        }
        logger.debug("Bands rebuilt: long {}/{} short {}/{}",
            longCloses.size(), longBands.getPeriod(), shortCloses.size(), shortBands.getPeriod());
    }

    public Bands snapshot() {
        lock.lock();
        try {
            return new Bands(longBands.bands(), shortBands.bands());
        } finally {
            lock.unlock();
        }
    }

    public boolean isReady() {
        lock.lock();
        try {
            return longBands.isReady() && shortBands.isReady();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fetch {@code 2 * period} klines per horizon and rebuild both windows.
     * A failed fetch is logged and leaves the current windows untouched.
     *
     * @return whether both windows are full after the refresh
     */
    public boolean refreshFromExchange(ExchangeGateway gateway, String symbol) {
        try {
            List<Double> longCloses = fetchCloses(gateway, symbol, longInterval, longBands.getPeriod());
            List<Double> shortCloses = fetchCloses(gateway, symbol, shortInterval, shortBands.getPeriod());
            refresh(longCloses, shortCloses);
        } catch (RuntimeException e) {
            logger.warn("Kline refresh failed for {}: {}", symbol, e.getMessage());
        }
        boolean ready = isReady();
        if (ready) {
            Bands bands = snapshot();
            logger.debug("📊 {} long [{}, {}] short [{}, {}]", symbol,
                round(bands.longBand().lower()), round(bands.longBand().upper()),
                round(bands.shortBand().lower()), round(bands.shortBand().upper()));
        }
        return ready;
    }

    private List<Double> fetchCloses(ExchangeGateway gateway, String symbol, String interval, int period) {
        List<Kline> klines = gateway.getKlines(symbol, interval, period * 2);
        return klines.stream()
            .sorted(Comparator.comparing(Kline::start))
            .map(Kline::close)
            .toList();
    }

    private static List<Double> tail(List<Double> values, int count) {
        return values.size() <= count ? values : values.subList(values.size() - count, values.size());
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
