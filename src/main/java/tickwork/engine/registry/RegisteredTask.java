package tickwork.engine.registry;

import tickwork.engine.config.QueueBinding;

import java.time.Duration;
import java.util.Objects;

/**
 * A task capability together with its declared queue and optional overrides.
 *
 * @param timeout     null to use the engine default
 * @param maxAttempts null to use the engine default
 */
public record RegisteredTask(
        String type,
        String queue,
        TaskCapability capability,
        Duration timeout,
        Integer maxAttempts) {

    public RegisteredTask {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(capability, "capability is required");
        QueueBinding.validateName(queue);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive for " + type);
        }
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 for " + type);
        }
    }

    public static RegisteredTask of(String type, String queue, TaskCapability capability) {
        return new RegisteredTask(type, queue, capability, null, null);
    }

    public RegisteredTask withTimeout(Duration timeout) {
        return new RegisteredTask(type, queue, capability, timeout, maxAttempts);
    }

    public RegisteredTask withMaxAttempts(int attempts) {
        return new RegisteredTask(type, queue, capability, timeout, attempts);
    }

    public Duration timeoutOr(Duration fallback) {
        return timeout != null ? timeout : fallback;
    }

    public int maxAttemptsOr(int fallback) {
        return maxAttempts != null ? maxAttempts : fallback;
    }
}
