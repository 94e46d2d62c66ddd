package tickwork.engine.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.store.Database;
import tickwork.engine.store.Jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static tickwork.engine.store.Jdbc.setTimestamp;
import static tickwork.engine.store.Jdbc.toInstant;
import static tickwork.engine.store.Jdbc.truncate;

/**
 * JDBC implementation of LockManager.
 *
 * <p>Acquisition is set-if-absent: a takeover of an expired row is a
 * conditional UPDATE, a fresh lock is an INSERT guarded by the primary key.
 * {@link #refresh(Connection, String, String, Duration)} and
 * {@link #release(Connection, String, String)} join a caller-owned transaction.
 */
public class JdbcLockManager implements LockManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcLockManager.class);

    private final Database db;
    private final Clock clock;

    public JdbcLockManager(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcLockManager(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    public Database database() {
        return db;
    }

    @Override
    public boolean tryAcquire(String key, String owner, Duration ttl) {
        String takeoverSql = """
                    UPDATE broker_locks
                    SET owner = ?, acquired_at = ?, expires_at = ?
                    WHERE lock_key = ? AND (owner = ? OR expires_at <= ?)
                """;

        String insertSql = "INSERT INTO broker_locks (lock_key, owner, acquired_at, expires_at) VALUES (?, ?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            Instant now = now();
            Instant expiresAt = truncate(now.plus(ttl));
            try {
                try (PreparedStatement ps = conn.prepareStatement(takeoverSql)) {
                    ps.setString(1, owner);
                    setTimestamp(ps, 2, now);
                    setTimestamp(ps, 3, expiresAt);
                    ps.setString(4, key);
                    ps.setString(5, owner);
                    setTimestamp(ps, 6, now);
                    if (ps.executeUpdate() > 0) {
                        conn.commit();
                        log.debug("Lock {} taken by {} until {}", key, owner, expiresAt);
                        return true;
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, key);
                    ps.setString(2, owner);
                    setTimestamp(ps, 3, now);
                    setTimestamp(ps, 4, expiresAt);
                    ps.executeUpdate();
                }
                conn.commit();
                log.debug("Lock {} acquired by {} until {}", key, owner, expiresAt);
                return true;
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                if (Jdbc.isUniqueViolation(e)) {
                    log.debug("Lock {} is held by another owner", key);
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerException("Failed to acquire lock " + key, e);
        }
    }

    @Override
    public boolean refresh(String key, String owner, Duration ttl) {
        try (Connection conn = db.getConnection()) {
            try {
                boolean refreshed = refresh(conn, key, owner, ttl);
                conn.commit();
                return refreshed;
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerException("Failed to refresh lock " + key, e);
        }
    }

    /**
     * Extend a lock without committing.
     */
    public boolean refresh(Connection conn, String key, String owner, Duration ttl) throws SQLException {
        String sql = "UPDATE broker_locks SET expires_at = ? WHERE lock_key = ? AND owner = ? AND expires_at > ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            Instant now = now();
            setTimestamp(ps, 1, truncate(now.plus(ttl)));
            ps.setString(2, key);
            ps.setString(3, owner);
            setTimestamp(ps, 4, now);
            boolean refreshed = ps.executeUpdate() > 0;
            if (!refreshed) {
                log.debug("Lock {} no longer held by {}", key, owner);
            }
            return refreshed;
        }
    }

    @Override
    public boolean release(String key, String owner) {
        try (Connection conn = db.getConnection()) {
            try {
                boolean released = release(conn, key, owner);
                conn.commit();
                return released;
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerException("Failed to release lock " + key, e);
        }
    }

    /**
     * Release a lock without committing.
     */
    public boolean release(Connection conn, String key, String owner) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM broker_locks WHERE lock_key = ? AND owner = ?")) {
            ps.setString(1, key);
            ps.setString(2, owner);
            boolean released = ps.executeUpdate() > 0;
            if (released) {
                log.debug("Lock {} released by {}", key, owner);
            }
            return released;
        }
    }

    @Override
    public Optional<LockInfo> holder(String key) {
        String sql = "SELECT * FROM broker_locks WHERE lock_key = ? AND expires_at > ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            setTimestamp(ps, 2, now());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new LockInfo(
                            rs.getString("lock_key"),
                            rs.getString("owner"),
                            toInstant(rs.getTimestamp("acquired_at")),
                            toInstant(rs.getTimestamp("expires_at"))));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new BrokerException("Failed to read lock " + key, e);
        }
    }

    private Instant now() {
        return truncate(clock.instant());
    }
}
