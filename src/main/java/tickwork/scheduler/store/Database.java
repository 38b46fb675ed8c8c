package tickwork.scheduler.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import tickwork.scheduler.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
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

    public Database(SchedulerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("tickwork-db-pool");
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
     * Get the underlying pooled DataSource, for callers that manage their own
     * connections.
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if the pool can hand out a valid connection.
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
     * Create the schedules, executions and locks tables with their indexes.
     * Safe to run against an existing schema.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SCHEDULES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedules (
                            id              VARCHAR(64) PRIMARY KEY,
                            owner_id        VARCHAR(128) NOT NULL,
                            name            VARCHAR(256),
                            description     VARCHAR(2048),
                            job_type        VARCHAR(128) NOT NULL,
                            job_config      CLOB,
                            schedule_type   VARCHAR(20) NOT NULL,
                            scheduled_at    TIMESTAMP,
                            recurrence_rule CLOB,
                            timezone        VARCHAR(64) DEFAULT 'UTC',
                            status          VARCHAR(20) DEFAULT 'ACTIVE',
                            priority        VARCHAR(20) DEFAULT 'NORMAL',
                            priority_weight INT DEFAULT 2,
                            next_run_at     TIMESTAMP,
                            last_run_at     TIMESTAMP,
                            run_count       INT DEFAULT 0,
                            max_runs        INT,
                            missed_policy   VARCHAR(20) DEFAULT 'SKIP',
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            version         BIGINT DEFAULT 0
                        );
                    """);

            // ---------- EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedule_executions (
                            id              VARCHAR(64) PRIMARY KEY,
                            job_id          VARCHAR(64) NOT NULL,
                            scheduled_for   TIMESTAMP NOT NULL,
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP,
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            manual          BOOLEAN DEFAULT FALSE,
                            error_message   VARCHAR(4096),
                            result_payload  CLOB
                        );
                    """);

            // ---------- LOCKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedule_locks (
                            lock_key        VARCHAR(256) PRIMARY KEY,
                            owner_id        VARCHAR(128) NOT NULL,
                            acquired_at     TIMESTAMP NOT NULL,
                            expires_at      TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_schedules_due ON schedules(status, next_run_at, priority_weight);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_schedules_owner ON schedules(owner_id, created_at);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_executions_job ON schedule_executions(job_id, scheduled_for);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_executions_running ON schedule_executions(status, started_at);");

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
