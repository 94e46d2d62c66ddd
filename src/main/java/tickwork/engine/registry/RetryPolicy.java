package tickwork.engine.registry;

import java.time.Duration;

/**
 * How many deliveries a message gets and how long to wait between them.
 * The delay doubles with each failed attempt, capped at {@code maxBackoff}.
 */
public record RetryPolicy(int maxAttempts, Duration backoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(backoff) < 0) {
            maxBackoff = backoff;
        }
    }

    /** True if a failure on {@code attempt} should be redelivered. */
    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /** Delay before redelivering after a failure on {@code attempt} (1-based). */
    public Duration delayFor(int attempt) {
        if (backoff.isZero()) {
            return Duration.ZERO;
        }
        int shift = Math.max(0, Math.min(attempt - 1, 30));
        long millis = backoff.toMillis();
        if (millis > maxBackoff.toMillis() >> shift) {
            return maxBackoff;
        }
        return Duration.ofMillis(Math.min(millis << shift, maxBackoff.toMillis()));
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, backoff, maxBackoff);
    }
}
