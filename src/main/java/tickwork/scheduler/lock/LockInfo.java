package tickwork.scheduler.lock;

import java.time.Duration;
import java.time.Instant;

/**
 * A held lock.
 *
 * @param key        lock key, usually {@link LockManager#jobKey(String)}
 * @param ownerId    holder identity
 * @param acquiredAt when the lock was taken or last refreshed
 * @param ttl        time after which the lock may be reclaimed
 */
public record LockInfo(String key, String ownerId, Instant acquiredAt, Duration ttl) {

    public Instant expiresAt() {
        return acquiredAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt());
    }
}
