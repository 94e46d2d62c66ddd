package tickwork.engine.registry;

import java.time.Instant;

/**
 * Delivery details handed to a running task.
 *
 * @param jobId null for ad-hoc dispatch
 */
public record TaskContext(
        String messageId,
        String jobId,
        String taskType,
        String queue,
        int attempt,
        int maxAttempts,
        String workerId,
        Instant startedAt) {

    public boolean isLastAttempt() {
        return attempt >= maxAttempts;
    }
}
