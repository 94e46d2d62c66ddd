package tickwork.engine.broker;

import java.time.Instant;

/**
 * Snapshot of a held lock.
 */
public record LockInfo(String key, String owner, Instant acquiredAt, Instant expiresAt) {
}
