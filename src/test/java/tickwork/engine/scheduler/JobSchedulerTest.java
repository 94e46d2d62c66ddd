package tickwork.engine.scheduler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.*;
import tickwork.engine.broker.BrokerException;
import tickwork.engine.broker.JdbcBroker;
import tickwork.engine.broker.JdbcLockManager;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.model.Job;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.registry.RegisteredTask;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.store.Database;
import tickwork.engine.store.JdbcJobRepository;
import tickwork.engine.support.MutableClock;
import tickwork.engine.support.TestDatabases;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private static Database db;
    private static MutableClock clock;
    private static JdbcJobRepository jobs;
    private static JdbcBroker broker;
    private static JdbcLockManager locks;
    private static TaskRegistry registry;
    private static EngineConfig config;

    private JobScheduler scheduler;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-scheduler");
        clock = new MutableClock(T);
        jobs = new JdbcJobRepository(db, clock);
        broker = new JdbcBroker(db, clock);
        locks = new JdbcLockManager(db, clock);
        registry = new TaskRegistry()
                .register("noop", "default", (params, ctx) -> JsonNodeFactory.instance.objectNode())
                .register(RegisteredTask.of("refresh_schemas", "schemas",
                        (params, ctx) -> JsonNodeFactory.instance.objectNode()).withMaxAttempts(5));
        config = EngineConfig.defaults().withLockTtl(Duration.ofMinutes(15));
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
        scheduler = new JobScheduler(jobs, broker, locks, registry, config, clock);
    }

    private static Job job(String id, String taskType, String schedule, Instant nextRun) {
        Job job = Job.builder()
                .id(id)
                .taskType(taskType)
                .schedule(schedule)
                .params("{\"id\":\"" + id + "\"}")
                .nextRun(nextRun)
                .build();
        jobs.save(job);
        return job;
    }

    private static List<TaskMessage> drain(String... queues) {
        List<TaskMessage> messages = new ArrayList<>();
        while (true) {
            Optional<TaskMessage> next = broker.dequeue(List.of(queues), Duration.ofMinutes(1));
            if (next.isEmpty()) {
                return messages;
            }
            messages.add(next.get());
        }
    }

    @Test
    @DisplayName("Late tick enqueues once and keeps the cadence")
    void lateTickEnqueuesOnce() {
        job("job-1", "noop", "60", T);
        clock.set(T.plusSeconds(5));

        TickReport report = scheduler.tick();

        assertEquals(1, report.due());
        assertEquals(1, report.enqueued());
        Job updated = jobs.findById("job-1").orElseThrow();
        assertEquals(T.plusSeconds(60), updated.nextRun());
        assertEquals(T.plusSeconds(5), updated.lastRun());

        List<TaskMessage> messages = drain("default");
        assertEquals(1, messages.size());
        TaskMessage message = messages.get(0);
        assertEquals("job-1", message.jobId());
        assertEquals("noop", message.taskType());
        assertEquals("{\"id\":\"job-1\"}", message.params());
        assertEquals(3, message.maxAttempts());
    }

    @Test
    @DisplayName("Second tick before the next slot enqueues nothing")
    void notDueTwice() {
        job("job-1", "noop", "60", T);
        scheduler.tick();

        clock.advance(Duration.ofSeconds(30));
        TickReport report = scheduler.tick();

        assertTrue(report.isIdle());
        assertEquals(1, drain("default").size());
    }

    @Test
    @DisplayName("Held lock skips the job without advancing it")
    void heldLockSkips() {
        job("job-1", "noop", "60", T);
        locks.tryAcquire(Job.lockKey("job-1"), "previous-message", Duration.ofMinutes(15));

        TickReport report = scheduler.tick();

        assertEquals(1, report.skippedLocked());
        assertEquals(0, report.enqueued());
        assertEquals(T, jobs.findById("job-1").orElseThrow().nextRun());
        assertTrue(drain("default").isEmpty());
    }

    @Test
    @DisplayName("Lock is owned by the enqueued message")
    void lockOwnedByMessage() {
        job("job-1", "noop", "60", T);

        scheduler.tick();

        TaskMessage message = drain("default").get(0);
        assertEquals(message.id(), locks.holder(Job.lockKey("job-1")).orElseThrow().owner());
    }

    @Test
    @DisplayName("Malformed schedule disables the job")
    void malformedScheduleDisables() {
        job("job-1", "noop", "every so often", T);

        TickReport report = scheduler.tick();

        assertEquals(1, report.disabled());
        Job disabled = jobs.findById("job-1").orElseThrow();
        assertFalse(disabled.enabled());
        assertTrue(disabled.disabledReason().contains("invalid schedule"));
        assertTrue(drain("default").isEmpty());
    }

    @Test
    @DisplayName("Interval whose next run overflows disables the job instead of failing every tick")
    void overflowingIntervalDisables() {
        job("job-1", "noop", "9223372036854775807", T);
        clock.set(T.plusSeconds(5));

        TickReport first = scheduler.tick();

        assertEquals(1, first.disabled());
        assertEquals(0, first.errored());
        Job disabled = jobs.findById("job-1").orElseThrow();
        assertFalse(disabled.enabled());
        assertTrue(disabled.disabledReason().contains("invalid schedule"));

        TickReport second = scheduler.tick();
        assertEquals(0, second.due());
        assertTrue(drain("default").isEmpty());
        assertTrue(locks.holder(Job.lockKey("job-1")).isEmpty());
    }

    @Test
    @DisplayName("Sub-millisecond interval disables the job")
    void subMillisecondIntervalDisables() {
        job("job-1", "noop", "PT0.0005S", T);
        clock.set(T.plusSeconds(5));

        TickReport report = scheduler.tick();

        assertEquals(1, report.disabled());
        Job disabled = jobs.findById("job-1").orElseThrow();
        assertFalse(disabled.enabled());
        assertEquals(T, disabled.nextRun());
        assertTrue(drain("default").isEmpty());
    }

    @Test
    @DisplayName("Millisecond interval advances strictly past the tick time")
    void millisecondIntervalAdvancesPastTick() {
        job("job-1", "noop", "PT0.001S", T);
        clock.set(T.plusSeconds(5).plusNanos(400_000));

        TickReport report = scheduler.tick();

        assertEquals(1, report.enqueued());
        Instant nextRun = jobs.findById("job-1").orElseThrow().nextRun();
        assertTrue(nextRun.isAfter(clock.instant()), "next run " + nextRun + " not after tick");
        assertEquals(T.plusSeconds(5).plusMillis(1), nextRun);
    }

    @Test
    @DisplayName("Unknown task type disables the job")
    void unknownTaskDisables() {
        job("job-1", "does_not_exist", "60", T);

        TickReport report = scheduler.tick();

        assertEquals(1, report.disabled());
        assertEquals("unknown task type: does_not_exist", jobs.findById("job-1").orElseThrow().disabledReason());
        assertTrue(locks.holder(Job.lockKey("job-1")).isEmpty());
    }

    @Test
    @DisplayName("Every due job is processed, each on its task queue")
    void processesAllDueJobs() {
        job("job-1", "noop", "60", T.minusSeconds(10));
        job("job-2", "refresh_schemas", "*/5 * * * *", T);
        job("job-3", "noop", "60", T.plusSeconds(3600));

        TickReport report = scheduler.tick();

        assertEquals(2, report.due());
        assertEquals(2, report.enqueued());
        assertEquals(List.of("job-1"), drain("default").stream().map(TaskMessage::jobId).toList());
        List<TaskMessage> schemas = drain("schemas");
        assertEquals(1, schemas.size());
        assertEquals(5, schemas.get(0).maxAttempts());
        assertEquals(Instant.parse("2024-01-01T00:05:00Z"), jobs.findById("job-2").orElseThrow().nextRun());
    }

    @Test
    @DisplayName("Job queue overrides the task queue")
    void jobQueueOverride() {
        jobs.save(Job.builder()
                .id("job-1")
                .taskType("noop")
                .schedule("60")
                .queue("emails")
                .nextRun(T)
                .build());

        scheduler.tick();

        assertEquals(1, drain("emails").size());
        assertTrue(drain("default").isEmpty());
    }

    @Test
    @DisplayName("Missed slots are coalesced into one run")
    void missedSlotsCoalesced() {
        job("job-1", "noop", "60", T);
        clock.set(T.plusSeconds(600));

        scheduler.tick();

        assertEquals(1, drain("default").size());
        assertEquals(T.plusSeconds(660), jobs.findById("job-1").orElseThrow().nextRun());
    }

    @Test
    @DisplayName("Broker failure aborts the tick and undoes the advance")
    void brokerDownAborts() {
        job("job-1", "noop", "60", T);
        JdbcBroker down = new JdbcBroker(db, clock) {
            @Override
            public void enqueue(TaskMessage message) {
                throw new BrokerException("connection refused");
            }
        };
        JobScheduler failing = new JobScheduler(jobs, down, locks, registry, config, clock);

        assertThrows(BrokerException.class, failing::tick);

        assertEquals(T, jobs.findById("job-1").orElseThrow().nextRun());
        assertTrue(locks.holder(Job.lockKey("job-1")).isEmpty());

        TickReport retry = scheduler.tick();
        assertEquals(1, retry.enqueued());
    }

    @Test
    @DisplayName("Concurrent schedulers enqueue a due slot once")
    void concurrentSchedulersEnqueueOnce() {
        job("job-1", "noop", "60", T);
        JobScheduler other = new JobScheduler(jobs, broker, locks, registry, config, clock);

        TickReport first = scheduler.tick();
        TickReport second = other.tick();

        assertEquals(1, first.enqueued() + second.enqueued());
        assertEquals(1, drain("default").size());
    }
}
