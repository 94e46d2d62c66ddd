package tickwork.engine.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.broker.Broker;
import tickwork.engine.model.ExecutionResult;
import tickwork.engine.model.ExecutionStatus;
import tickwork.engine.model.TaskMessage;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background task that settles messages whose final delivery was never
 * acknowledged.
 *
 * <p>A message that still has attempts left is redelivered by the broker once
 * its visibility window expires. One whose last allowed delivery expired
 * (the worker died or hung on the final attempt) is never handed out again, so
 * the reaper moves it to the dead letters and writes its final FAILURE result.
 * When several reapers race, or the worker settles the message late, only
 * the one that removes the message writes the result.
 */
public class MessageReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MessageReaper.class);

    static final int BATCH_SIZE = 100;

    private final Broker broker;
    private final ResultWriter writer;
    private final Clock clock;
    private final String workerId;

    public MessageReaper(Broker broker, ResultWriter writer, Clock clock, String workerId) {
        this.broker = broker;
        this.writer = writer;
        this.clock = clock;
        this.workerId = workerId;
    }

    @Override
    public void run() {
        try {
            reapExpired();
        } catch (Exception e) {
            log.error("Message reaper error", e);
        }
    }

    /**
     * Dead-letter expired, exhausted messages.
     *
     * @return number of messages this reaper settled
     */
    public int reapExpired() {
        Instant now = clock.instant();
        List<TaskMessage> expired = broker.findExpiredExhausted(now, BATCH_SIZE);

        if (expired.isEmpty()) {
            log.debug("No expired messages found");
            return 0;
        }

        int reaped = 0;
        for (TaskMessage message : expired) {
            String error = "visibility timeout expired on final attempt " + message.attempts() + "/"
                    + message.maxAttempts() + " (worker lost)";
            ExecutionResult result = ExecutionResult.forMessage(message)
                    .status(ExecutionStatus.FAILURE)
                    .error(error)
                    .finishedAt(now)
                    .workerId(workerId)
                    .build();
            if (writer.deadLetterExpired(message, result)) {
                reaped++;
            }
        }

        log.info("Message reaper: {} dead-lettered, {} expired found", reaped, expired.size());
        return reaped;
    }
}
