package exray.bridge.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import exray.bridge.config.BridgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * HikariCP pool over the run registry database. Creates the {@code runs} table on startup.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    // One JSON document per run; the timestamp columns only serve ordering and auditing.
    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS runs (
                id          VARCHAR(64) PRIMARY KEY,
                document    CLOB NOT NULL,
                created_at  TIMESTAMP NOT NULL,
                updated_at  TIMESTAMP NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_runs_created ON runs(created_at)");

    private final HikariDataSource dataSource;

    public Database(BridgeConfig config) {
        String url = config.databaseUrl();
        int poolSize = config.databasePoolSize();

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(url);
        hikari.setMaximumPoolSize(poolSize);
        hikari.setMinimumIdle(Math.min(2, poolSize));
        hikari.setConnectionTimeout(5000);
        hikari.setIdleTimeout(300000);
        hikari.setPoolName("exray-registry");
        hikari.setAutoCommit(false);
        if (url.startsWith("jdbc:h2:") && !url.toUpperCase().contains("MODE=")) {
            hikari.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikari);
        log.info("Registry pool initialized: {} (max {} connections)", url, poolSize);

        try {
            createSchema();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Caller closes the connection. Auto-commit is off.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Registry health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void createSchema() {
        try (Connection conn = getConnection(); Statement st = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                st.execute(ddl);
            }
            conn.commit();
            log.debug("Registry schema ready");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create registry schema", e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Registry pool closed");
        }
    }
}
