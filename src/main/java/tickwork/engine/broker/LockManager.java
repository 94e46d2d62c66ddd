package tickwork.engine.broker;

import java.time.Duration;
import java.util.Optional;

/**
 * Ephemeral, expiring locks held in the broker.
 * At most one live lock exists per key; an expired lock is free for anyone.
 */
public interface LockManager {

    /**
     * Take the lock if it is absent or expired. If {@code owner} already holds
     * it, the expiry is extended.
     *
     * @return true if {@code owner} holds the lock afterwards
     */
    boolean tryAcquire(String key, String owner, Duration ttl);

    /**
     * Extend a lock still held by {@code owner}.
     *
     * @return false if the lock was lost
     */
    boolean refresh(String key, String owner, Duration ttl);

    /**
     * Release a lock held by {@code owner}. Releasing someone else's lock is a no-op.
     *
     * @return true if a lock was removed
     */
    boolean release(String key, String owner);

    /** Current live holder, if any. */
    Optional<LockInfo> holder(String key);
}
