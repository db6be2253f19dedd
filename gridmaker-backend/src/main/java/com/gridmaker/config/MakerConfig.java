package com.gridmaker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Grid maker configuration loaded from a properties file.
 * All strategy, feed, ledger and scheduling parameters are read through this class.
 *
 * Instances are immutable and handed to each component explicitly; there is no
 * process-wide singleton.
 */
public final class MakerConfig {
    private static final Logger logger = LoggerFactory.getLogger(MakerConfig.class);

    private static final String CONFIG_FILE = "config.properties";

    private final Properties properties;

    // Instrument and endpoints
    private final String symbol;
    private final String apiUrl;
    private final String wsUrl;
    private final String apiVersion;
    private final String signatureWindow;

    // Capital allocation
    private final double orderAmount;
    private final double totalInvestment;
    private final int pricePrecision;
    private final int quantityPrecision;
    private final double baseOrderSize;
    private final double quoteOrderSize;

    // Spread
    private final double spread;
    private final boolean dynamicSpread;
    private final double spreadMin;
    private final double spreadMax;
    private final double lowVolatilityThreshold;
    private final double highVolatilityThreshold;
    private final boolean trendSkew;
    private final double uptrendSkew;
    private final double downtrendSkew;

    // Bollinger bands
    private final String longBollInterval;
    private final int longBollPeriod;
    private final double longBollStd;
    private final String shortBollInterval;
    private final int shortBollPeriod;
    private final double shortBollStd;

    // Position control
    private final double maxPositionScale;
    private final double minPositionScale;
    private final double minProfitSpread;
    private final boolean tradeInBand;
    private final boolean buyBelowSma;

    // Risk
    private final double stopLossActivation;
    private final double stopLossRatio;
    private final double takeProfitRatio;

    // Grid
    private final int gridLevelsPerSide;
    private final double gridStep;
    private final double gridSideBudgetRatio;

    // Timing
    private final long orderIntervalMs;
    private final long klineRefreshIntervalMs;
    private final long positionRefreshIntervalMs;
    private final long positionReadTimeoutMs;
    private final long heartbeatTimeoutMs;
    private final long heartbeatCheckIntervalMs;
    private final long pingIntervalMs;
    private final long wsCheckIntervalMs;
    private final long wsCheckMaxIntervalMs;
    private final long startupTimeoutMs;

    // Retry
    private final int restMaxAttempts;
    private final long retryBaseDelayMs;
    private final long retryMaxDelayMs;
    private final int startupConnectAttempts;
    private final int restRequestsPerSecond;

    // Ledger
    private final String dbPath;
    private final int tradeRetentionDays;

    private MakerConfig(Properties props) {
        this.properties = props;

        this.symbol = props.getProperty("SYMBOL", "SOL_USDC_PERP").trim();
        this.apiUrl = props.getProperty("API_URL", "https://api.backpack.exchange").trim();
        this.wsUrl = props.getProperty("WS_URL", "wss://ws.backpack.exchange").trim();
        this.apiVersion = props.getProperty("API_VERSION", "v1").trim();
        this.signatureWindow = props.getProperty("DEFAULT_WINDOW", "5000").trim();

        this.orderAmount = parseDouble("ORDER_AMOUNT", 2.0);
        this.totalInvestment = parseDouble("GRID_TOTAL_INVESTMENT", 200.0);
        this.pricePrecision = parseInt("PRICE_PRECISION", 2);
        this.quantityPrecision = parseInt("QUANTITY_PRECISION", 2);
        this.baseOrderSize = parseDouble("BASE_ORDER_SIZE", 0.1);
        this.quoteOrderSize = parseDouble("QUOTE_ORDER_SIZE", 4.0);

        this.spread = parseDouble("SPREAD", 0.00018);
        this.dynamicSpread = parseBoolean("DYNAMIC_SPREAD", true);
        this.spreadMin = parseDouble("SPREAD_MIN", 0.00022);
        this.spreadMax = parseDouble("SPREAD_MAX", 0.001);
        this.lowVolatilityThreshold = parseDouble("LOW_VOLATILITY_THRESHOLD", 0.0025);
        this.highVolatilityThreshold = parseDouble("HIGH_VOLATILITY_THRESHOLD", 0.05);
        this.trendSkew = parseBoolean("TREND_SKEW", true);
        this.uptrendSkew = parseDouble("UPTREND_SKEW", 0.8);
        this.downtrendSkew = parseDouble("DOWNTREND_SKEW", 1.2);

        this.longBollInterval = props.getProperty("LONG_BOLL_INTERVAL", "1h").trim();
        this.longBollPeriod = parseInt("LONG_BOLL_PERIOD", 21);
        this.longBollStd = parseDouble("LONG_BOLL_STD", 2.0);
        this.shortBollInterval = props.getProperty("SHORT_BOLL_INTERVAL", "5m").trim();
        this.shortBollPeriod = parseInt("SHORT_BOLL_PERIOD", 21);
        this.shortBollStd = parseDouble("SHORT_BOLL_STD", 2.0);

        this.maxPositionScale = parseDouble("MAX_POSITION_SCALE", 10.0);
        this.minPositionScale = parseDouble("MIN_POSITION_SCALE", 1.0);
        this.minProfitSpread = parseDouble("MIN_PROFIT_SPREAD", 0.0005);
        this.tradeInBand = parseBoolean("TRADE_IN_BAND", true);
        this.buyBelowSma = parseBoolean("BUY_BELOW_SMA", false);

        this.stopLossActivation = parseDouble("STOP_LOSS_ACTIVATION", 0.02);
        this.stopLossRatio = parseDouble("STOP_LOSS_RATIO", 0.03);
        this.takeProfitRatio = parseDouble("TAKE_PROFIT_RATIO", 0.008);

        this.gridLevelsPerSide = parseInt("GRID_LEVELS_PER_SIDE", 6);
        this.gridStep = parseDouble("GRID_STEP", 0.0002);
        this.gridSideBudgetRatio = parseDouble("GRID_SIDE_BUDGET_RATIO", 0.5);

        this.orderIntervalMs = parseLong("ORDER_INTERVAL_MS", 120_000);
        this.klineRefreshIntervalMs = parseLong("KLINE_REFRESH_INTERVAL_MS", 60_000);
        this.positionRefreshIntervalMs = parseLong("POSITION_REFRESH_INTERVAL_MS", 1_000);
        this.positionReadTimeoutMs = parseLong("POSITION_READ_TIMEOUT_MS", 1_000);
        this.heartbeatTimeoutMs = parseLong("HEARTBEAT_TIMEOUT_MS", 30_000);
        this.heartbeatCheckIntervalMs = parseLong("HEARTBEAT_CHECK_INTERVAL_MS", 5_000);
        this.pingIntervalMs = parseLong("PING_INTERVAL_MS", 15_000);
        this.wsCheckIntervalMs = parseLong("WS_CHECK_INTERVAL_MS", 30_000);
        this.wsCheckMaxIntervalMs = parseLong("WS_CHECK_MAX_INTERVAL_MS", 300_000);
        this.startupTimeoutMs = parseLong("STARTUP_TIMEOUT_MS", 30_000);

        this.restMaxAttempts = parseInt("REST_MAX_ATTEMPTS", 3);
        this.retryBaseDelayMs = parseLong("RETRY_BASE_DELAY_MS", 1_000);
        this.retryMaxDelayMs = parseLong("RETRY_MAX_DELAY_MS", 60_000);
        this.startupConnectAttempts = parseInt("STARTUP_CONNECT_ATTEMPTS", 3);
        this.restRequestsPerSecond = parseInt("REST_REQUESTS_PER_SECOND", 10);

        this.dbPath = props.getProperty("DB_PATH", "data/positions.db").trim();
        this.tradeRetentionDays = parseInt("TRADE_RETENTION_DAYS", 15);

        logger.info("Grid maker configuration loaded for {}", symbol);
        logger.info("   Grid: {} levels/side, step={}, side budget={}%",
            gridLevelsPerSide, gridStep, String.format("%.0f", gridSideBudgetRatio * 100));
        logger.info("   Spread: [{}, {}] dynamic={} trendSkew={}", spreadMin, spreadMax, dynamicSpread, trendSkew);
        logger.info("   Risk: SL activation={} SL={} TP={}", stopLossActivation, stopLossRatio, takeProfitRatio);
    }

    private double parseDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private int parseInt(String key, int defaultValue) {
        return (int) parseLong(key, defaultValue);
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Load configuration from config.properties, trying the working directory first
     * and the classpath second. Missing files fall back to defaults.
     */
    public static MakerConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new MakerConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", CONFIG_FILE, e.getMessage());
            }
        }

        try (InputStream is = MakerConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new MakerConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", CONFIG_FILE, e.getMessage());
        }

        logger.warn("No {} found, using defaults", CONFIG_FILE);
        return new MakerConfig(props);
    }

    /**
     * Create an instance from explicit properties (tests, embedded use).
     */
    public static MakerConfig forTest(Properties testProps) {
        return new MakerConfig(testProps);
    }

    // ========== Getters ==========

    public String getSymbol() {
        return symbol;
    }

    /** Base asset of the symbol, e.g. SOL for SOL_USDC_PERP */
    public String getBaseAsset() {
        return symbol.split("_")[0];
    }

    /** Quote asset of the symbol, e.g. USDC for SOL_USDC_PERP */
    public String getQuoteAsset() {
        String[] parts = symbol.split("_");
        return parts.length > 1 ? parts[1] : "USDC";
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public String getWsUrl() {
        return wsUrl;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getSignatureWindow() {
        return signatureWindow;
    }

    /** Quote-currency amount per order */
    public double getOrderAmount() {
        return orderAmount;
    }

    /** Total capital allocated to the grid, in quote currency */
    public double getTotalInvestment() {
        return totalInvestment;
    }

    public int getPricePrecision() {
        return pricePrecision;
    }

    public int getQuantityPrecision() {
        return quantityPrecision;
    }

    /** Per-level order size in base asset units */
    public double getBaseOrderSize() {
        return baseOrderSize;
    }

    public double getQuoteOrderSize() {
        return quoteOrderSize;
    }

    /** Static spread used when dynamic spread is disabled */
    public double getSpread() {
        return spread;
    }

    public boolean isDynamicSpread() {
        return dynamicSpread;
    }

    public double getSpreadMin() {
        return spreadMin;
    }

    public double getSpreadMax() {
        return spreadMax;
    }

    public double getLowVolatilityThreshold() {
        return lowVolatilityThreshold;
    }

    public double getHighVolatilityThreshold() {
        return highVolatilityThreshold;
    }

    public boolean isTrendSkew() {
        return trendSkew;
    }

    public double getUptrendSkew() {
        return uptrendSkew;
    }

    public double getDowntrendSkew() {
        return downtrendSkew;
    }

    public String getLongBollInterval() {
        return longBollInterval;
    }

    public int getLongBollPeriod() {
        return longBollPeriod;
    }

    public double getLongBollStd() {
        return longBollStd;
    }

    public String getShortBollInterval() {
        return shortBollInterval;
    }

    public int getShortBollPeriod() {
        return shortBollPeriod;
    }

    public double getShortBollStd() {
        return shortBollStd;
    }

    public double getMaxPositionScale() {
        return maxPositionScale;
    }

    public double getMinPositionScale() {
        return minPositionScale;
    }

    public double getMinProfitSpread() {
        return minProfitSpread;
    }

    public boolean isTradeInBand() {
        return tradeInBand;
    }

    public boolean isBuyBelowSma() {
        return buyBelowSma;
    }

    /** |ROI| at which the stop-loss check becomes active, e.g. 0.02 */
    public double getStopLossActivation() {
        return stopLossActivation;
    }

    public double getStopLossRatio() {
        return stopLossRatio;
    }

    public double getTakeProfitRatio() {
        return takeProfitRatio;
    }

    public int getGridLevelsPerSide() {
        return gridLevelsPerSide;
    }

    public double getGridStep() {
        return gridStep;
    }

    public double getGridSideBudgetRatio() {
        return gridSideBudgetRatio;
    }

    public Duration getOrderInterval() {
        return Duration.ofMillis(orderIntervalMs);
    }

    public Duration getKlineRefreshInterval() {
        return Duration.ofMillis(klineRefreshIntervalMs);
    }

    public Duration getPositionRefreshInterval() {
        return Duration.ofMillis(positionRefreshIntervalMs);
    }

    public Duration getPositionReadTimeout() {
        return Duration.ofMillis(positionReadTimeoutMs);
    }

    public Duration getHeartbeatTimeout() {
        return Duration.ofMillis(heartbeatTimeoutMs);
    }

    public Duration getHeartbeatCheckInterval() {
        return Duration.ofMillis(heartbeatCheckIntervalMs);
    }

    public Duration getPingInterval() {
        return Duration.ofMillis(pingIntervalMs);
    }

    public Duration getWsCheckInterval() {
        return Duration.ofMillis(wsCheckIntervalMs);
    }

    public Duration getWsCheckMaxInterval() {
        return Duration.ofMillis(wsCheckMaxIntervalMs);
    }

    public Duration getStartupTimeout() {
        return Duration.ofMillis(startupTimeoutMs);
    }

    public int getRestMaxAttempts() {
        return restMaxAttempts;
    }

    public Duration getRetryBaseDelay() {
        return Duration.ofMillis(retryBaseDelayMs);
    }

    public Duration getRetryMaxDelay() {
        return Duration.ofMillis(retryMaxDelayMs);
    }

    public int getStartupConnectAttempts() {
        return startupConnectAttempts;
    }

    public int getRestRequestsPerSecond() {
        return restRequestsPerSecond;
    }

    public String getDbPath() {
        return dbPath;
    }

    public int getTradeRetentionDays() {
        return tradeRetentionDays;
    }

    /** Get raw property value */
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    /** Get property with default */
    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }
}
