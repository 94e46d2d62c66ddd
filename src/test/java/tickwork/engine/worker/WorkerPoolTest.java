package tickwork.engine.worker;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.*;
import tickwork.engine.broker.JdbcBroker;
import tickwork.engine.broker.JdbcLockManager;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.config.QueueBinding;
import tickwork.engine.model.ExecutionResult;
import tickwork.engine.model.ExecutionStatus;
import tickwork.engine.model.Job;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.registry.RegisteredTask;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.store.Database;
import tickwork.engine.store.JdbcExecutionResultRepository;
import tickwork.engine.support.MutableClock;
import tickwork.engine.support.TestDatabases;
import tickwork.engine.tasks.EchoTask;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private static Database db;
    private static MutableClock clock;
    private static JdbcBroker broker;
    private static JdbcLockManager locks;
    private static JdbcExecutionResultRepository results;

    private EngineConfig config;
    private TaskRegistry registry;
    private WorkerPool pool;
    private CountDownLatch started;
    private CountDownLatch release;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-worker");
        clock = new MutableClock(T);
        broker = new JdbcBroker(db, clock);
        locks = new JdbcLockManager(db, clock);
        results = new JdbcExecutionResultRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        TestDatabases.clearAll(db);
        clock.set(T);
        config = EngineConfig.defaults()
                .withQueues(QueueBinding.of("default"))
                .withWorkersCount(2)
                .withRetryBackoff(Duration.ZERO)
                .withTaskTimeout(Duration.ofSeconds(5))
                .withShutdownGrace(Duration.ofSeconds(2))
                .withPollInterval(Duration.ofMillis(20));
        started = new CountDownLatch(4);
        release = new CountDownLatch(1);
        registry = new TaskRegistry()
                .register(EchoTask.TYPE, EchoTask.QUEUE, new EchoTask())
                .register(RegisteredTask.of("slow", "default", new EchoTask()).withTimeout(Duration.ofMillis(200)))
                .register("blocking", "default", (params, ctx) -> {
                    started.countDown();
                    awaitIgnoringInterrupts(release);
                    return JsonNodeFactory.instance.objectNode().put("released", true);
                })
                .register(RegisteredTask.of("stubborn", "default", (params, ctx) -> {
                    awaitIgnoringInterrupts(release);
                    return null;
                }).withTimeout(Duration.ofMillis(200)));
        pool = newPool();
    }

    @AfterEach
    void stopPool() {
        pool.shutdown();
    }

    private WorkerPool newPool() {
        ResultWriter writer = new ResultWriter(results, broker, locks, config);
        return new WorkerPool(broker, registry, writer, config, clock, "worker-test");
    }

    /** Block on a latch the way a capability that does not react to interruption would. */
    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void enqueueAdHoc(String taskType) {
        broker.enqueue(TaskMessage.builder()
                .id(TaskMessage.newId())
                .queue("default")
                .taskType(taskType)
                .build());
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
    }

    /** Enqueue a scheduled message and take its job lock the way the scheduler does. */
    private static TaskMessage enqueue(String taskType, String params, int maxAttempts) {
        TaskMessage message = TaskMessage.builder()
                .id(TaskMessage.newId())
                .queue("default")
                .jobId("job-1")
                .taskType(taskType)
                .params(params)
                .maxAttempts(maxAttempts)
                .build();
        assertTrue(locks.tryAcquire(Job.lockKey("job-1"), message.id(), Duration.ofMinutes(15)));
        broker.enqueue(message);
        return message;
    }

    @Test
    @DisplayName("Success records a final result, acks and releases the job lock")
    void successAcksAndReleasesLock() {
        TaskMessage message = enqueue("echo", "{\"n\":42}", 3);

        ExecutionResult result = pool.runNext().orElseThrow();

        assertEquals(ExecutionStatus.SUCCESS, result.status());
        assertTrue(result.terminal());
        assertTrue(broker.find(message.id()).isEmpty());
        assertTrue(locks.holder(Job.lockKey("job-1")).isEmpty());

        List<ExecutionResult> stored = results.findByMessageId(message.id());
        assertEquals(1, stored.size());
        assertTrue(stored.get(0).output().contains("\"n\":42"));
        assertEquals("worker-test", stored.get(0).workerId());
        assertEquals(1, pool.processed());
        assertEquals(0, pool.failed());
    }

    @Test
    @DisplayName("Failing task is retried up to maxAttempts, then dead-lettered once")
    void failingTaskExhaustsAttempts() {
        TaskMessage message = enqueue("echo", "{\"fail\":\"boom\"}", 3);

        ExecutionResult first = pool.runNext().orElseThrow();
        assertFalse(first.terminal());
        assertTrue(locks.holder(Job.lockKey("job-1")).isPresent());

        ExecutionResult second = pool.runNext().orElseThrow();
        assertFalse(second.terminal());

        ExecutionResult third = pool.runNext().orElseThrow();
        assertTrue(third.terminal());
        assertEquals(3, third.attempt());

        assertTrue(pool.runNext().isEmpty());

        List<ExecutionResult> stored = results.findByMessageId(message.id());
        assertEquals(3, stored.size());
        assertEquals(1, stored.stream().filter(ExecutionResult::terminal).count());
        assertTrue(stored.stream().allMatch(r -> r.status() == ExecutionStatus.FAILURE));
        assertEquals("IllegalStateException: boom", stored.get(2).error());

        assertEquals(1, broker.deadLetters("default", 10).size());
        assertTrue(locks.holder(Job.lockKey("job-1")).isEmpty());
        assertEquals(3, pool.failed());
    }

    @Test
    @DisplayName("Task that fails once succeeds on redelivery")
    void transientFailureRecovers() {
        TaskMessage message = enqueue("echo", "{\"failUntilAttempt\":2}", 3);

        assertEquals(ExecutionStatus.FAILURE, pool.runNext().orElseThrow().status());
        ExecutionResult second = pool.runNext().orElseThrow();

        assertEquals(ExecutionStatus.SUCCESS, second.status());
        assertEquals(2, second.attempt());
        assertEquals(2, results.findByMessageId(message.id()).size());
        assertEquals(0, broker.deadLetterCount());
    }

    @Test
    @DisplayName("Task over its timeout is recorded as TIMEOUT")
    void timeoutIsRecorded() {
        enqueue("slow", "{\"sleepMs\":5000}", 1);

        ExecutionResult result = pool.runNext().orElseThrow();

        assertEquals(ExecutionStatus.TIMEOUT, result.status());
        assertTrue(result.terminal());
        assertTrue(result.error().startsWith("timed out after"));
        assertEquals(1, broker.deadLetterCount());
    }

    @Test
    @DisplayName("Unknown task type is dead-lettered without retries")
    void unknownTaskTypeIsPermanent() {
        TaskMessage message = enqueue("vanished", "{}", 3);

        ExecutionResult result = pool.runNext().orElseThrow();

        assertTrue(result.terminal());
        assertEquals("unknown task type: vanished", result.error());
        assertTrue(broker.find(message.id()).isEmpty());
        assertEquals(1, broker.deadLetterCount());
    }

    @Test
    @DisplayName("Unparseable params are dead-lettered without retries")
    void invalidParamsArePermanent() {
        enqueue("echo", "{not json", 3);

        ExecutionResult result = pool.runNext().orElseThrow();

        assertTrue(result.terminal());
        assertTrue(result.error().startsWith("invalid params"));
        assertEquals(1, broker.deadLetterCount());
    }

    @Test
    @DisplayName("Ad-hoc message without a job runs without a lock")
    void adHocMessage() {
        TaskMessage message = TaskMessage.builder()
                .id(TaskMessage.newId())
                .queue("default")
                .taskType("echo")
                .build();
        broker.enqueue(message);

        ExecutionResult result = pool.runNext().orElseThrow();

        assertTrue(result.isSuccess());
        assertNull(result.jobId());
    }

    @Test
    @DisplayName("Empty queues yield nothing")
    void emptyQueues() {
        assertEquals(Optional.empty(), pool.runNext());
    }

    @Test
    @DisplayName("Binding an undeclared queue fails at startup")
    void undeclaredQueueRejected() {
        config.withQueues(QueueBinding.of("default", "no_such_queue"));
        WorkerPool misconfigured = newPool();
        try {
            assertThrows(IllegalStateException.class, misconfigured::start);
            assertFalse(misconfigured.isRunning());
        } finally {
            misconfigured.shutdown();
        }
    }

    @Test
    @DisplayName("Started pool drains the queue in the background")
    void backgroundProcessing() throws Exception {
        for (int i = 0; i < 5; i++) {
            broker.enqueue(TaskMessage.builder()
                    .id(TaskMessage.newId())
                    .queue("default")
                    .taskType("echo")
                    .params("{\"sleepMs\":20}")
                    .build());
        }

        pool.start();
        long deadline = System.currentTimeMillis() + 10_000;
        while (pool.processed() < 5 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(5, pool.processed());
        assertEquals(0, broker.stats("default").total());
        pool.shutdown();
        assertFalse(pool.isRunning());
        assertEquals(0, pool.inFlight());
    }

    @Test
    @DisplayName("Final attempt that outlives its delivery keeps only the reaper's failure")
    void finalAttemptOutlivingVisibilityRecordsOneTerminalResult() {
        config.withVisibilityTimeout(Duration.ofSeconds(30));
        registry.register("overrun", "default", (params, ctx) -> {
            clock.advance(Duration.ofSeconds(31));
            pool.reaper().reapExpired();
            return JsonNodeFactory.instance.objectNode();
        });
        TaskMessage message = enqueue("overrun", "{}", 1);

        Optional<ExecutionResult> result = pool.runNext();

        assertTrue(result.isEmpty());
        List<ExecutionResult> stored = results.findByMessageId(message.id());
        assertEquals(1, stored.size());
        assertEquals(ExecutionStatus.FAILURE, stored.get(0).status());
        assertTrue(stored.get(0).terminal());
        assertEquals(1, broker.deadLetterCount());
        assertTrue(broker.find(message.id()).isEmpty());
        assertTrue(locks.holder(Job.lockKey("job-1")).isEmpty());
        assertEquals(0, pool.processed());
    }

    @Test
    @DisplayName("Busy pool stops dequeuing until a slot frees up")
    void busyPoolAppliesBackpressure() throws Exception {
        for (int i = 0; i < 4; i++) {
            enqueueAdHoc("blocking");
        }

        pool.start();
        waitUntil(() -> started.getCount() == 2);
        Thread.sleep(200);

        assertEquals(2, started.getCount());
        assertEquals(2, pool.inFlight());
        assertEquals(2, broker.stats("default").ready());
        assertEquals(2, broker.stats("default").inFlight());

        release.countDown();
        waitUntil(() -> pool.processed() == 4);

        assertEquals(4, pool.processed());
        assertEquals(0, broker.stats("default").total());
    }

    @Test
    @DisplayName("Task outliving the shutdown grace is abandoned and redelivered after the visibility timeout")
    void shutdownAbandonsStuckTaskToRedelivery() throws Exception {
        config.withShutdownGrace(Duration.ofMillis(200));
        TaskMessage message = enqueue("blocking", "{}", 3);

        pool.start();
        waitUntil(() -> started.getCount() == 3);
        assertEquals(1, pool.inFlight());
        pool.shutdown();

        assertFalse(pool.isRunning());
        assertTrue(results.findByMessageId(message.id()).isEmpty());
        TaskMessage held = broker.find(message.id()).orElseThrow();
        assertEquals(1, held.attempts());
        assertNotNull(held.receipt());

        release.countDown();
        clock.advance(config.visibilityTimeout());
        WorkerPool next = newPool();
        try {
            ExecutionResult redelivered = next.runNext().orElseThrow();

            assertEquals(ExecutionStatus.SUCCESS, redelivered.status());
            assertEquals(2, redelivered.attempt());
            assertEquals(1, results.findByMessageId(message.id()).size());
        } finally {
            next.shutdown();
        }
    }

    @Test
    @DisplayName("Timed-out task that ignores interruption is tracked until it exits")
    void runawayTaskIsTracked() throws Exception {
        enqueue("stubborn", "{}", 1);

        ExecutionResult result = pool.runNext().orElseThrow();

        assertEquals(ExecutionStatus.TIMEOUT, result.status());
        assertEquals(1, pool.runningTasks());

        release.countDown();
        waitUntil(() -> pool.runningTasks() == 0);
        assertEquals(0, pool.runningTasks());
    }

    @Test
    @DisplayName("Task timeout not below the visibility timeout fails at startup")
    void taskTimeoutBeyondVisibilityRejected() {
        registry.register(RegisteredTask.of("long", "default", new EchoTask()).withTimeout(Duration.ofMinutes(20)));

        IllegalStateException e = assertThrows(IllegalStateException.class, pool::start);

        assertTrue(e.getMessage().contains("long=PT20M"));
        assertFalse(pool.isRunning());
    }
}
