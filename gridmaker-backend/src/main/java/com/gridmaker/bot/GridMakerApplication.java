package com.gridmaker.bot;

import com.gridmaker.api.BackpackRestClient;
import com.gridmaker.api.RequestSigner;
import com.gridmaker.api.RetryPolicy;
import com.gridmaker.broker.FeedException;
import com.gridmaker.broker.JdkWebSocketConnector;
import com.gridmaker.broker.MarketDataFeed;
import com.gridmaker.config.ExchangeCredentials;
import com.gridmaker.config.MakerConfig;
import com.gridmaker.indicators.IndicatorEngine;
import com.gridmaker.metrics.MakerMetrics;
import com.gridmaker.persistence.LedgerException;
import com.gridmaker.persistence.PositionLedger;
import com.gridmaker.portfolio.AccountBalances;
import com.gridmaker.portfolio.PositionCache;
import com.gridmaker.risk.RiskControl;
import com.gridmaker.strategy.OrderingEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;

/**
 * Entry point: wires one maker for the configured symbol and runs it until the JVM stops.
 */
public final class GridMakerApplication {
    private static final Logger logger = LoggerFactory.getLogger(GridMakerApplication.class);

    private GridMakerApplication() {
    }

    public static void main(String[] args) {
        var config = MakerConfig.load();

        ExchangeCredentials credentials;
        try {
            credentials = ExchangeCredentials.resolve(config).validate();
        } catch (IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        var clock = Clock.systemUTC();
        var registry = new SimpleMeterRegistry();
        var metrics = new MakerMetrics(registry, config.getSymbol());

        var signer = new RequestSigner(credentials, config.getSignatureWindow(), clock);
        var gateway = new BackpackRestClient(config, signer, RetryPolicy.fromConfig("backpack-rest", config), registry);

        PositionLedger ledger;
        try {
            ledger = new PositionLedger(config.getDbPath(), config.getTradeRetentionDays(), clock);
        } catch (LedgerException e) {
            logger.error("Cannot open position ledger", e);
            System.exit(1);
            return;
        }

        var positions = new PositionCache(ledger, config.getSymbol(),
            config.getPositionRefreshInterval(), config.getPositionReadTimeout(), metrics, clock);
        var indicators = new IndicatorEngine(config);
        var riskControl = new RiskControl(config, gateway, positions, metrics);
        var engine = new OrderingEngine(config, gateway, indicators, positions, riskControl, metrics, clock);

        var feed = new MarketDataFeed(new JdkWebSocketConnector(), URI.create(config.getWsUrl()), signer,
            RetryPolicy.fromConfig("backpack-ws", config), metrics, clock,
            config.getHeartbeatTimeout(), config.getPingInterval());
        var balances = new AccountBalances(gateway, config.getBaseAsset(), config.getQuoteAsset());

        var scheduler = new TradingScheduler(config, gateway, feed, indicators, positions, ledger, engine,
            balances, clock);

        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdown, "maker-shutdown"));

        try {
            scheduler.start(true);
        } catch (FeedException | IllegalStateException e) {
            logger.error("❌ Startup failed: {}", e.getMessage());
            System.exit(1);
            return;
        }

        try {
            scheduler.awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdown();
        }
    }
}
