package foreman.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import foreman.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("foreman-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check that a pooled connection can still reach the database.
     * Backs the {@code database} field of the health endpoint.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Create the task and dependency-edge tables if they are missing.
     * Existing rows are kept, so a file-backed URL resumes an earlier run.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(128) PRIMARY KEY,
                            seq             BIGINT NOT NULL,
                            title           VARCHAR(512) NOT NULL,
                            instruction     CLOB NOT NULL,
                            target_paths    CLOB NOT NULL,
                            branch          VARCHAR(256),
                            priority        VARCHAR(16) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            attempts        INT DEFAULT 0,
                            max_attempts    INT DEFAULT 3,
                            assigned_to     VARCHAR(64),
                            last_error      VARCHAR(2048),
                            result          CLOB,
                            created_at      TIMESTAMP NOT NULL,
                            updated_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- DEPENDENCY EDGES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_dependencies (
                            task_id         VARCHAR(128) NOT NULL,
                            depends_on      VARCHAR(128) NOT NULL,
                            position        INT NOT NULL,
                            PRIMARY KEY (task_id, depends_on)
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_seq ON tasks(status, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_deps_depends_on ON task_dependencies(depends_on);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
