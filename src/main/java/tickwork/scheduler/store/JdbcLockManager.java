package tickwork.scheduler.store;

import tickwork.scheduler.lock.LockInfo;
import tickwork.scheduler.lock.LockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lock manager backed by the schedule_locks table, so that several scheduler
 * processes sharing one database exclude each other.
 *
 * Acquisition is a conditional UPDATE (same owner, or expired holder) followed
 * by an INSERT when no row exists. The primary key on lock_key arbitrates
 * between concurrent inserts.
 */
public class JdbcLockManager implements LockManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcLockManager.class);

    private final Database db;
    private final Clock clock;
    private final Duration retryInterval;

    public JdbcLockManager(Database db) {
        this(db, Clock.systemUTC(), Duration.ofMillis(100));
    }

    public JdbcLockManager(Database db, Clock clock, Duration retryInterval) {
        this.db = db;
        this.clock = clock;
        this.retryInterval = retryInterval;
    }

    @Override
    public boolean acquire(String key, String ownerId, Duration timeout, Duration ttl) {
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            if (tryAcquire(key, ownerId, ttl)) {
                return true;
            }

            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                log.debug("Lock {} not acquired by {} within {}", key, ownerId, timeout);
                return false;
            }

            try {
                long sleepMs = Math.max(1, Math.min(retryInterval.toMillis(), remainingNanos / 1_000_000));
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private boolean tryAcquire(String key, String ownerId, Duration ttl) {
        String updateSql = """
                    UPDATE schedule_locks
                    SET owner_id = ?, acquired_at = ?, expires_at = ?
                    WHERE lock_key = ? AND (owner_id = ? OR expires_at < ?)
                """;
        String insertSql = """
                    INSERT INTO schedule_locks (lock_key, owner_id, acquired_at, expires_at)
                    VALUES (?, ?, ?, ?)
                """;

        Instant now = clock.instant();
        Timestamp acquiredAt = Timestamp.from(now);
        Timestamp expiresAt = Timestamp.from(now.plus(ttl));

        try (Connection conn = db.getConnection()) {
            try {
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, ownerId);
                    ps.setTimestamp(2, acquiredAt);
                    ps.setTimestamp(3, expiresAt);
                    ps.setString(4, key);
                    ps.setString(5, ownerId);
                    ps.setTimestamp(6, acquiredAt);
                    if (ps.executeUpdate() > 0) {
                        conn.commit();
                        return true;
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, key);
                    ps.setString(2, ownerId);
                    ps.setTimestamp(3, acquiredAt);
                    ps.setTimestamp(4, expiresAt);
                    ps.executeUpdate();
                }
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isContention(e)) {
                    log.trace("Lock {} contended: {}", key, e.getMessage());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to acquire lock: " + key, e);
        }
    }

    /** Duplicate key (another holder inserted first) or a row lock wait timeout */
    private static boolean isContention(SQLException e) {
        String state = e.getSQLState();
        return state != null && (state.startsWith("23") || state.equals("HYT00") || state.equals("40001"));
    }

    @Override
    public boolean release(String key, String ownerId) {
        String sql = "DELETE FROM schedule_locks WHERE lock_key = ? AND owner_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, ownerId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lock: " + key, e);
        }
    }

    @Override
    public boolean isLocked(String key) {
        return ownerOf(key).isPresent();
    }

    @Override
    public Optional<String> ownerOf(String key) {
        String sql = "SELECT owner_id FROM schedule_locks WHERE lock_key = ? AND expires_at >= ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setTimestamp(2, Timestamp.from(clock.instant()));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString("owner_id")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read lock: " + key, e);
        }
    }

    @Override
    public boolean forceRelease(String key) {
        String sql = "DELETE FROM schedule_locks WHERE lock_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            int deleted = ps.executeUpdate();
            conn.commit();
            if (deleted > 0) {
                log.warn("Force released lock {}", key);
            }
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to force release lock: " + key, e);
        }
    }

    @Override
    public List<LockInfo> activeLocks() {
        String sql = "SELECT * FROM schedule_locks WHERE expires_at >= ? ORDER BY acquired_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            List<LockInfo> locks = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Instant acquired = rs.getTimestamp("acquired_at").toInstant();
                    Instant expires = rs.getTimestamp("expires_at").toInstant();
                    locks.add(new LockInfo(rs.getString("lock_key"), rs.getString("owner_id"), acquired,
                            Duration.between(acquired, expires)));
                }
            }
            return locks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list locks", e);
        }
    }
}
