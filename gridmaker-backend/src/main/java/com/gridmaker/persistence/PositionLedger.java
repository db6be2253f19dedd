package com.gridmaker.persistence;

import com.gridmaker.api.model.Fill;
import com.gridmaker.api.model.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite store for net position, cost basis and the trade log.
 *
 * Meant to be driven by a single owner (see {@code PositionCache}); the lock only
 * protects the shared JDBC connection against stray callers such as shutdown hooks.
 */
public final class PositionLedger implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PositionLedger.class);

    public static final int DEFAULT_KEEP_DAYS = 15;

    private final Connection connection;
    private final StampedLock lock = new StampedLock();
    private final Clock clock;
    private final int keepDays;

    public PositionLedger(String dbPath) {
        this(dbPath, DEFAULT_KEEP_DAYS, Clock.systemUTC());
    }

    public PositionLedger(String dbPath, int keepDays, Clock clock) {
        this.clock = clock;
        this.keepDays = keepDays;
        try {
            Path parent = Path.of(dbPath).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            createTables();
            logger.info("Position ledger initialized: {} (keep {} days)", dbPath, keepDays);
        } catch (SQLException | IOException e) {
            throw new LedgerException("Failed to initialize ledger at " + dbPath, e);
        }
        pruneTrades();
    }

    private void createTables() throws SQLException {
        String positionsSql = """
            CREATE TABLE IF NOT EXISTS positions (
                symbol TEXT PRIMARY KEY,
                size REAL NOT NULL DEFAULT 0,
                cost REAL NOT NULL DEFAULT 0,
                updated_at INTEGER NOT NULL
            )
            """;

        String tradesSql = """
            CREATE TABLE IF NOT EXISTS trades (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                symbol TEXT NOT NULL,
                side TEXT NOT NULL,
                price REAL NOT NULL,
                quantity REAL NOT NULL,
                executed_at INTEGER NOT NULL,
                FOREIGN KEY (symbol) REFERENCES positions(symbol)
            )
            """;

        String indexSql = """
            CREATE INDEX IF NOT EXISTS idx_trades_symbol_time
            ON trades(symbol, executed_at)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute("PRAGMA foreign_keys = ON");
            stmt.execute(positionsSql);
            stmt.execute(tradesSql);
            stmt.execute(indexSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Current position, or an empty one if the symbol has never traded.
     */
    public Position getPosition(String symbol) {
        String sql = "SELECT size, cost, updated_at FROM positions WHERE symbol = ?";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return new Position(symbol, rs.getDouble("size"), rs.getDouble("cost"),
                        Instant.ofEpochMilli(rs.getLong("updated_at")));
                }
                return Position.empty(symbol);
            }
        } catch (SQLException e) {
            logger.error("Failed to read position for {}", symbol, e);
            throw new LedgerException("Database read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Upsert size and cost, clamped at zero, stamping updated_at.
     */
    public Position updatePosition(String symbol, double size, double cost) {
        long stamp = lock.writeLock();
        try {
            return upsert(symbol, size, cost);
        } catch (SQLException e) {
            logger.error("Failed to update position for {}", symbol, e);
            throw new LedgerException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    private Position upsert(String symbol, double size, double cost) throws SQLException {
        String sql = """
            INSERT INTO positions (symbol, size, cost, updated_at) VALUES (?, ?, ?, ?)
            ON CONFLICT(symbol) DO UPDATE SET
                size = excluded.size,
                cost = excluded.cost,
                updated_at = excluded.updated_at
            """;
        Position position = new Position(symbol, size, cost, clock.instant());
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            stmt.setDouble(2, position.size());
            stmt.setDouble(3, position.cost());
            stmt.setLong(4, position.updatedAt().toEpochMilli());
            stmt.executeUpdate();
        }
        return position;
    }

    /**
     * Append a trade, then prune trades past retention.
     */
    public void addTrade(String symbol, Side side, double price, double quantity) {
        long stamp = lock.writeLock();
        try {
            insertTrade(symbol, side, price, quantity);
        } catch (SQLException e) {
            logger.error("Failed to record trade for {}", symbol, e);
            throw new LedgerException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
        pruneTrades();
    }

    private void insertTrade(String symbol, Side side, double price, double quantity) throws SQLException {
        // The trades table references positions, so make sure the parent row exists
        try (var stmt = connection.prepareStatement(
                "INSERT OR IGNORE INTO positions (symbol, size, cost, updated_at) VALUES (?, 0, 0, ?)")) {
            stmt.setString(1, symbol);
            stmt.setLong(2, clock.millis());
            stmt.executeUpdate();
        }
        String sql = "INSERT INTO trades (symbol, side, price, quantity, executed_at) VALUES (?, ?, ?, ?, ?)";
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            stmt.setString(2, side.wireName());
            stmt.setDouble(3, price);
            stmt.setDouble(4, quantity);
            stmt.setLong(5, clock.millis());
            stmt.executeUpdate();
        }
    }

    /**
     * Apply one fill atomically: recompute size and cost, upsert the position and append the trade.
     * A buy adds quantity and notional. A sell removes quantity and the same fraction of cost.
     */
    public Position applyFill(Fill fill) {
        Position updated;
        long stamp = lock.writeLock();
        try {
            Position current = getPositionUnlocked(fill.symbol());
            double size = current.size();
            double cost = current.cost();

            if (fill.side() == Side.BID) {
                size += fill.quantity();
                cost += fill.notional();
            } else {
                double reduction = size > 0 ? (fill.quantity() / size) * cost : cost;
                size -= fill.quantity();
                cost -= reduction;
            }

            connection.setAutoCommit(false);
            try {
                updated = upsert(fill.symbol(), Math.max(0.0, size), Math.max(0.0, cost));
                insertTrade(fill.symbol(), fill.side(), fill.price(), fill.quantity());
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }

            logger.atInfo()
                .addKeyValue("symbol", fill.symbol())
                .addKeyValue("side", fill.side())
                .addKeyValue("price", fill.price())
                .addKeyValue("quantity", fill.quantity())
                .addKeyValue("size", updated.size())
                .addKeyValue("cost", updated.cost())
                .log("Fill applied to ledger");
        } catch (SQLException e) {
            logger.error("Failed to apply fill {} for {}", fill.orderId(), fill.symbol(), e);
            throw new LedgerException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
        pruneTrades();
        return updated;
    }

    private Position getPositionUnlocked(String symbol) throws SQLException {
        try (var stmt = connection.prepareStatement(
                "SELECT size, cost, updated_at FROM positions WHERE symbol = ?")) {
            stmt.setString(1, symbol);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return new Position(symbol, rs.getDouble("size"), rs.getDouble("cost"),
                        Instant.ofEpochMilli(rs.getLong("updated_at")));
                }
                return Position.empty(symbol);
            }
        }
    }

    /**
     * Most recent trades first.
     */
    public List<TradeRecord> recentTrades(String symbol, int limit) {
        String sql = """
            SELECT id, symbol, side, price, quantity, executed_at FROM trades
            WHERE symbol = ? ORDER BY executed_at DESC, id DESC LIMIT ?
            """;

        List<TradeRecord> trades = new ArrayList<>();
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    trades.add(new TradeRecord(
                        rs.getLong("id"),
                        rs.getString("symbol"),
                        Side.fromWire(rs.getString("side")),
                        rs.getDouble("price"),
                        rs.getDouble("quantity"),
                        Instant.ofEpochMilli(rs.getLong("executed_at"))
                    ));
                }
            }
        } catch (SQLException e) {
            logger.error("Failed to read trades for {}", symbol, e);
            throw new LedgerException("Database read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
        return trades;
    }

    /**
     * Delete trades older than the retention window. Compacts the file when anything was removed.
     *
     * @return number of deleted trades
     */
    public int pruneTrades() {
        long cutoff = clock.instant().minus(Duration.ofDays(keepDays)).toEpochMilli();

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement("DELETE FROM trades WHERE executed_at < ?")) {
            stmt.setLong(1, cutoff);
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                try (var vacuum = connection.createStatement()) {
                    vacuum.execute("VACUUM");
                }
                logger.info("Pruned {} trades older than {} days", deleted, keepDays);
            }
            return deleted;
        } catch (SQLException e) {
            logger.error("Failed to prune trades", e);
            throw new LedgerException("Database prune failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void close() {
        long stamp = lock.writeLock();
        try {
            if (!connection.isClosed()) {
                connection.close();
                logger.info("Position ledger closed");
            }
        } catch (SQLException e) {
            logger.error("Failed to close ledger", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }
}
