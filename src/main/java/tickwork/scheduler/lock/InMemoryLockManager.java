package tickwork.scheduler.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local lock manager. Only arbitrates between threads of one JVM;
 * several scheduler instances need the JDBC implementation.
 */
public final class InMemoryLockManager implements LockManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLockManager.class);

    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofMillis(100);

    private final Map<String, LockInfo> locks = new HashMap<>();
    private final Clock clock;
    private final Duration retryInterval;

    public InMemoryLockManager() {
        this(Clock.systemUTC(), DEFAULT_RETRY_INTERVAL);
    }

    /**
     * @param clock         source of lock ages (TTL checks)
     * @param retryInterval pause between acquisition attempts
     */
    public InMemoryLockManager(Clock clock, Duration retryInterval) {
        this.clock = clock;
        this.retryInterval = retryInterval;
    }

    @Override
    public boolean acquire(String key, String ownerId, Duration timeout, Duration ttl) {
        // deadline on the monotonic clock; the injected clock only ages locks
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

    private synchronized boolean tryAcquire(String key, String ownerId, Duration ttl) {
        Instant now = clock.instant();
        reclaimExpired(now);

        LockInfo existing = locks.get(key);
        if (existing == null || existing.ownerId().equals(ownerId)) {
            locks.put(key, new LockInfo(key, ownerId, now, ttl));
            return true;
        }
        return false;
    }

    @Override
    public synchronized boolean release(String key, String ownerId) {
        LockInfo existing = locks.get(key);
        if (existing == null || !existing.ownerId().equals(ownerId)) {
            return false;
        }
        locks.remove(key);
        return true;
    }

    @Override
    public synchronized boolean isLocked(String key) {
        reclaimExpired(clock.instant());
        return locks.containsKey(key);
    }

    @Override
    public synchronized Optional<String> ownerOf(String key) {
        reclaimExpired(clock.instant());
        return Optional.ofNullable(locks.get(key)).map(LockInfo::ownerId);
    }

    @Override
    public synchronized boolean forceRelease(String key) {
        LockInfo removed = locks.remove(key);
        if (removed != null) {
            log.warn("Force released lock {} held by {}", key, removed.ownerId());
            return true;
        }
        return false;
    }

    @Override
    public synchronized List<LockInfo> activeLocks() {
        reclaimExpired(clock.instant());
        return List.copyOf(locks.values());
    }

    /** Must be called while holding this object's monitor */
    private void reclaimExpired(Instant now) {
        locks.values().removeIf(lock -> {
            if (lock.isExpired(now)) {
                log.info("Reclaimed expired lock {} held by {}", lock.key(), lock.ownerId());
                return true;
            }
            return false;
        });
    }
}
