package tickwork.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; callers commit or roll back explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final String jdbcUrl;

    /**
     * Open a pool.
     *
     * @throws StoreException if the database cannot be reached
     */
    public Database(String jdbcUrl, int poolSize, String poolName) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName(poolName);
        hikariConfig.setAutoCommit(false);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            throw new StoreException("Cannot open database pool " + poolName + " for " + jdbcUrl, e);
        }
        this.jdbcUrl = jdbcUrl;

        log.info("Database pool {} initialized: {}", poolName, jdbcUrl);
    }

    /**
     * Run idempotent DDL statements in one batch.
     */
    public Database initSchema(String component, List<String> statements) {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            for (String sql : statements) {
                st.addBatch(sql);
            }
            st.executeBatch();
            conn.commit();

            log.info("{} schema initialized", component);
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize " + component + " schema", e);
        }
        return this;
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool {} closed", dataSource.getPoolName());
        }
    }
}
