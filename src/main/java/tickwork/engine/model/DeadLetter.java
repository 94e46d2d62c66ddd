package tickwork.engine.model;

import java.time.Instant;

/**
 * A message that exhausted its retry budget and was moved out of its queue.
 */
public record DeadLetter(
        String messageId,
        String queue,
        String jobId,
        String taskType,
        String params,
        int attempts,
        String error,
        Instant enqueuedAt,
        Instant deadLetteredAt) {
}
