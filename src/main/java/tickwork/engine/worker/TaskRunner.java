package tickwork.engine.worker;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.model.AckResult;
import tickwork.engine.model.ExecutionResult;
import tickwork.engine.model.ExecutionStatus;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.registry.RegisteredTask;
import tickwork.engine.registry.RetryPolicy;
import tickwork.engine.registry.TaskContext;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.util.Json;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one delivered message and settles it with the broker.
 *
 * <p>Settlement:
 * <ul>
 * <li>success: ack, final result</li>
 * <li>failure or timeout with attempts left: retry after backoff, intermediate result</li>
 * <li>failure or timeout on the last attempt: dead letter, final result</li>
 * <li>unknown task type or unparseable params: dead letter, final result</li>
 * </ul>
 * The result is recorded only if the delivery receipt is still current when
 * the message is settled. If the worker is interrupted while the task runs
 * (forced shutdown) the message is left unsettled and the broker redelivers
 * it after the visibility timeout.
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    /** How long a timed-out task gets to react to interruption before it is reported as runaway. */
    static final Duration CANCEL_GRACE = Duration.ofSeconds(1);

    private final TaskRegistry registry;
    private final ResultWriter writer;
    private final EngineConfig config;
    private final ExecutorService taskExecutor;
    private final Clock clock;
    private final String workerId;
    private final AtomicInteger runningTasks = new AtomicInteger();

    public TaskRunner(TaskRegistry registry, ResultWriter writer, EngineConfig config,
            ExecutorService taskExecutor, Clock clock, String workerId) {
        this.registry = registry;
        this.writer = writer;
        this.config = config;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
        this.workerId = workerId;
    }

    /**
     * Run and settle a message.
     *
     * @return the recorded result, empty if the message was abandoned or its delivery expired
     */
    public Optional<ExecutionResult> run(TaskMessage message) {
        Instant startedAt = clock.instant();
        ExecutionResult.Builder result = ExecutionResult.forMessage(message)
                .startedAt(startedAt)
                .workerId(workerId);

        Optional<RegisteredTask> task = registry.find(message.taskType());
        if (task.isEmpty()) {
            return settlePermanentFailure(message,
                    result.status(ExecutionStatus.FAILURE)
                            .error("unknown task type: " + message.taskType())
                            .finishedAt(clock.instant())
                            .build());
        }

        JsonNode params;
        try {
            params = Json.parse(message.params());
        } catch (IllegalArgumentException e) {
            return settlePermanentFailure(message,
                    result.status(ExecutionStatus.FAILURE)
                            .error("invalid params: " + e.getMessage())
                            .finishedAt(clock.instant())
                            .build());
        }

        TaskContext ctx = new TaskContext(message.id(), message.jobId(), message.taskType(), message.queue(),
                message.attempts(), message.maxAttempts(), workerId, startedAt);
        Duration timeout = task.get().timeoutOr(config.taskTimeout());

        log.debug("Running {} ({}) attempt {}/{}", message.id(), message.taskType(),
                message.attempts(), message.maxAttempts());

        CountDownLatch exited = new CountDownLatch(1);
        Future<JsonNode> future = taskExecutor.submit(() -> {
            runningTasks.incrementAndGet();
            try {
                return task.get().capability().execute(params, ctx);
            } finally {
                runningTasks.decrementAndGet();
                exited.countDown();
            }
        });
        try {
            JsonNode output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            result.status(ExecutionStatus.SUCCESS).output(Json.write(output));
        } catch (TimeoutException e) {
            future.cancel(true);
            awaitCancelled(message, exited);
            result.status(ExecutionStatus.TIMEOUT).error("timed out after " + timeout);
        } catch (ExecutionException e) {
            result.status(ExecutionStatus.FAILURE).error(describe(e.getCause()));
        } catch (CancellationException e) {
            result.status(ExecutionStatus.FAILURE).error("cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted while running {}, leaving it for redelivery", message.id());
            return Optional.empty();
        }

        ExecutionResult finished = result.finishedAt(clock.instant()).build();
        return settle(message, finished);
    }

    private void awaitCancelled(TaskMessage message, CountDownLatch exited) {
        try {
            if (!exited.await(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Task {} ({}) ignored interruption and is still running after its timeout",
                        message.id(), message.taskType());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Optional<ExecutionResult> settle(TaskMessage message, ExecutionResult result) {
        if (result.isSuccess()) {
            AckResult ack = writer.ack(message, result);
            if (!ack.isAcked()) {
                return discarded(message, result, ack);
            }
            log.info("Task {} ({}) succeeded in {}ms", message.id(), message.taskType(), result.runtimeMs());
            return Optional.of(result.toBuilder().terminal(true).build());
        }

        RetryPolicy policy = new RetryPolicy(message.maxAttempts(), config.retryBackoff(), config.maxRetryBackoff());
        if (policy.canRetry(message.attempts())) {
            Duration delay = policy.delayFor(message.attempts());
            AckResult ack = writer.retry(message, result, delay);
            if (!ack.isAcked()) {
                return discarded(message, result, ack);
            }
            log.warn("Task {} ({}) attempt {}/{} {}: {}, retrying in {}", message.id(), message.taskType(),
                    message.attempts(), message.maxAttempts(), result.status(), result.error(), delay);
            return Optional.of(result.toBuilder().terminal(false).build());
        }

        return deadLetter(message, result);
    }

    private Optional<ExecutionResult> settlePermanentFailure(TaskMessage message, ExecutionResult result) {
        log.warn("Task {} cannot run: {}", message.id(), result.error());
        return deadLetter(message, result);
    }

    private Optional<ExecutionResult> deadLetter(TaskMessage message, ExecutionResult result) {
        AckResult ack = writer.deadLetter(message, result);
        if (!ack.isAcked()) {
            return discarded(message, result, ack);
        }
        log.warn("Task {} ({}) failed permanently after {} attempt(s): {}", message.id(), message.taskType(),
                message.attempts(), result.error());
        return Optional.of(result.toBuilder().terminal(true).build());
    }

    private Optional<ExecutionResult> discarded(TaskMessage message, ExecutionResult result, AckResult ack) {
        log.warn("Task {} ({}) finished {} but its delivery is no longer current ({}), result discarded",
                message.id(), message.taskType(), result.status(), ack);
        return Optional.empty();
    }

    /** Capabilities currently executing, including timed-out ones that ignored interruption. */
    public int runningTasks() {
        return runningTasks.get();
    }

    static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getName() : t.getClass().getSimpleName() + ": " + msg;
    }
}
