package tickwork.engine.broker;

import tickwork.engine.model.AckResult;
import tickwork.engine.model.DeadLetter;
import tickwork.engine.model.TaskMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Named queues with at-least-once delivery.
 *
 * <p>A dequeued message is hidden for a visibility window and carries a fresh
 * receipt. It is removed only when the holder of that receipt settles it
 * ({@link #ack}, {@link #deadLetter}) or hands it back ({@link #retry}). If the
 * window expires first the message becomes dequeueable again with its attempt
 * count incremented on the next delivery. Messages that used up
 * {@code maxAttempts} deliveries are never handed out again.
 *
 * <p>All methods throw {@link BrokerException} when the broker is unreachable.
 */
public interface Broker {

    /**
     * Add a message to its queue. The message becomes visible at
     * {@link TaskMessage#visibleAt()} or immediately when that is null.
     */
    void enqueue(TaskMessage message);

    /**
     * Take the oldest visible message from the first non-empty queue, in the
     * given order.
     *
     * @return the delivered message with attempts incremented and a new receipt
     */
    Optional<TaskMessage> dequeue(List<String> queues, Duration visibilityTimeout);

    /** Remove a message after a terminal outcome. */
    AckResult ack(String messageId, String receipt);

    /** Hand a message back for redelivery after {@code delay}. */
    AckResult retry(String messageId, String receipt, Duration delay, String error);

    /** Move a message that exhausted its attempts to the dead-letter store. */
    AckResult deadLetter(String messageId, String receipt, String error);

    /**
     * Messages whose last allowed delivery expired without being settled,
     * i.e. the worker died on the final attempt.
     */
    List<TaskMessage> findExpiredExhausted(Instant now, int limit);

    /**
     * Dead-letter an expired, exhausted message found by
     * {@link #findExpiredExhausted}. Only one caller wins per message.
     *
     * @return true if this caller moved the message
     */
    boolean deadLetterExpired(TaskMessage message, String error);

    Optional<TaskMessage> find(String messageId);

    QueueStats stats(String queue);

    List<DeadLetter> deadLetters(String queue, int limit);

    int deadLetterCount();

    boolean isHealthy();
}
