package tickwork.scheduler.lock;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Short-lived, TTL-bounded mutual exclusion keyed by job identity.
 *
 * Guarantees at most one live (non-expired) holder per key. Expired locks are
 * reclaimed lazily. TTL reclaim is crash recovery only: a holder that outlives
 * its TTL can lose the lock to another owner.
 *
 * Implementations:
 * - {@link InMemoryLockManager}: single process
 * - {@code JdbcLockManager}: shared table, safe across scheduler instances
 */
public interface LockManager {

    /**
     * Try to take the lock, retrying at a short interval until {@code timeout}
     * elapses. Succeeds immediately if the key is free or already held by
     * {@code ownerId}, in which case the lock is refreshed.
     *
     * @return true if the caller now holds the lock; false means someone else
     *         does, which is not an error
     */
    boolean acquire(String key, String ownerId, Duration timeout, Duration ttl);

    /**
     * Release a lock held by {@code ownerId}.
     *
     * @return false if the lock is not held by that owner
     */
    boolean release(String key, String ownerId);

    boolean isLocked(String key);

    Optional<String> ownerOf(String key);

    /**
     * Drop a lock regardless of owner. Admin and crash-recovery use only.
     *
     * @return true if a lock was removed
     */
    boolean forceRelease(String key);

    /** Live locks, for monitoring */
    List<LockInfo> activeLocks();

    /** Lock key protecting the executions of one job */
    static String jobKey(String jobId) {
        return "schedule:" + jobId + ":lock";
    }
}
