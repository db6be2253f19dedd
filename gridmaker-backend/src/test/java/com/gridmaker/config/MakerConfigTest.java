package com.gridmaker.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MakerConfig Tests")
class MakerConfigTest {

    private static MakerConfig config(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return MakerConfig.forTest(props);
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should fall back to the documented defaults when nothing is set")
        void testDefaults() {
            MakerConfig config = config();

            assertEquals("SOL_USDC_PERP", config.getSymbol());
            assertEquals("SOL", config.getBaseAsset());
            assertEquals("USDC", config.getQuoteAsset());
            assertEquals("https://api.backpack.exchange", config.getApiUrl());
            assertEquals("wss://ws.backpack.exchange", config.getWsUrl());
            assertEquals("5000", config.getSignatureWindow());

            assertEquals(2.0, config.getOrderAmount(), 1e-12);
            assertEquals(200.0, config.getTotalInvestment(), 1e-12);
            assertEquals(4.0, config.getQuoteOrderSize(), 1e-12);
            assertEquals(0.1, config.getBaseOrderSize(), 1e-12);

            assertEquals(0.00022, config.getSpreadMin(), 1e-12);
            assertEquals(0.001, config.getSpreadMax(), 1e-12);
            assertTrue(config.isDynamicSpread());
            assertTrue(config.isTradeInBand());
            assertFalse(config.isBuyBelowSma());

            assertEquals(21, config.getLongBollPeriod());
            assertEquals("1h", config.getLongBollInterval());
            assertEquals("5m", config.getShortBollInterval());

            assertEquals(6, config.getGridLevelsPerSide());
            assertEquals(0.0002, config.getGridStep(), 1e-12);
            assertEquals(0.5, config.getGridSideBudgetRatio(), 1e-12);

            assertEquals(0.02, config.getStopLossActivation(), 1e-12);
            assertEquals(0.03, config.getStopLossRatio(), 1e-12);
            assertEquals(0.008, config.getTakeProfitRatio(), 1e-12);
        }

        @Test
        @DisplayName("Should expose timing values as durations")
        void testTimingDefaults() {
            MakerConfig config = config();

            assertEquals(Duration.ofMinutes(2), config.getOrderInterval());
            assertEquals(Duration.ofSeconds(60), config.getKlineRefreshInterval());
            assertEquals(Duration.ofSeconds(5), config.getHeartbeatCheckInterval());
            assertEquals(Duration.ofSeconds(30), config.getWsCheckInterval());
            assertEquals(Duration.ofMinutes(5), config.getWsCheckMaxInterval());
            assertEquals(Duration.ofSeconds(30), config.getStartupTimeout());
            assertEquals(15, config.getTradeRetentionDays());
            assertEquals("data/positions.db", config.getDbPath());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("Should read explicit values")
        void testOverrides() {
            MakerConfig config = config(
                "SYMBOL", "BTC_USDC",
                "GRID_LEVELS_PER_SIDE", "4",
                "TREND_SKEW", "false",
                "ORDER_INTERVAL_MS", "5000",
                "SPREAD_MAX", "0.002");

            assertEquals("BTC_USDC", config.getSymbol());
            assertEquals("BTC", config.getBaseAsset());
            assertEquals(4, config.getGridLevelsPerSide());
            assertFalse(config.isTrendSkew());
            assertEquals(Duration.ofSeconds(5), config.getOrderInterval());
            assertEquals(0.002, config.getSpreadMax(), 1e-12);
        }

        @Test
        @DisplayName("Should keep the default when a number cannot be parsed")
        void testInvalidNumberFallsBack() {
            MakerConfig config = config(
                "GRID_STEP", "not-a-number",
                "PRICE_PRECISION", "");

            assertEquals(0.0002, config.getGridStep(), 1e-12);
            assertEquals(2, config.getPricePrecision());
        }

        @Test
        @DisplayName("Should give access to raw properties")
        void testRawProperty() {
            MakerConfig config = config("BACKPACK_API_KEY", "key");

            assertEquals("key", config.getProperty("BACKPACK_API_KEY"));
            assertNull(config.getProperty("MISSING"));
        }
    }
}
