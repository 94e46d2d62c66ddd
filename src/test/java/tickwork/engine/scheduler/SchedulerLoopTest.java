package tickwork.engine.scheduler;

import org.junit.jupiter.api.*;
import tickwork.engine.broker.JdbcBroker;
import tickwork.engine.broker.JdbcLockManager;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.store.Database;
import tickwork.engine.store.JdbcJobRepository;
import tickwork.engine.support.MutableClock;
import tickwork.engine.support.TestDatabases;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerLoopTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private static Database db;
    private static MutableClock clock;
    private static JdbcLockManager locks;
    private static JobScheduler scheduler;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-scheduler-loop");
        clock = new MutableClock(T);
        locks = new JdbcLockManager(db, clock);
        scheduler = new JobScheduler(new JdbcJobRepository(db, clock), new JdbcBroker(db, clock), locks,
                new TaskRegistry(), EngineConfig.defaults(), clock);
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
    }

    private static EngineConfig config(boolean lease) {
        return EngineConfig.defaults().withTickInterval(Duration.ofSeconds(5)).withLeaderLease(lease);
    }

    @Test
    void onlyLeaseHolderTicks() {
        SchedulerLoop a = new SchedulerLoop(scheduler, locks, config(true), "scheduler-a");
        SchedulerLoop b = new SchedulerLoop(scheduler, locks, config(true), "scheduler-b");

        assertTrue(a.runOnce().isPresent());
        assertEquals(Optional.empty(), b.runOnce());
        assertTrue(a.isLeader());
        assertFalse(b.isLeader());
        assertEquals("scheduler-a", locks.holder(SchedulerLoop.LEADER_KEY).orElseThrow().owner());
    }

    @Test
    void standbyTakesOverAfterLeaseExpires() {
        SchedulerLoop a = new SchedulerLoop(scheduler, locks, config(true), "scheduler-a");
        SchedulerLoop b = new SchedulerLoop(scheduler, locks, config(true), "scheduler-b");
        a.runOnce();

        clock.advance(Duration.ofSeconds(15));

        assertTrue(b.runOnce().isPresent());
        assertTrue(a.runOnce().isEmpty());
        assertFalse(a.isLeader());
    }

    @Test
    void leaderRenewsItsLease() {
        SchedulerLoop a = new SchedulerLoop(scheduler, locks, config(true), "scheduler-a");
        SchedulerLoop b = new SchedulerLoop(scheduler, locks, config(true), "scheduler-b");
        a.runOnce();

        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofSeconds(5));
            assertTrue(a.runOnce().isPresent());
            assertTrue(b.runOnce().isEmpty());
        }
    }

    @Test
    void withoutLeaseEveryInstanceTicks() {
        SchedulerLoop a = new SchedulerLoop(scheduler, locks, config(false), "scheduler-a");
        SchedulerLoop b = new SchedulerLoop(scheduler, locks, config(false), "scheduler-b");

        assertTrue(a.runOnce().isPresent());
        assertTrue(b.runOnce().isPresent());
        assertTrue(b.isLeader());
        assertTrue(locks.holder(SchedulerLoop.LEADER_KEY).isEmpty());
    }

    @Test
    void leaseIsThreeTicks() {
        SchedulerLoop loop = new SchedulerLoop(scheduler, locks, config(true), "scheduler-a");

        assertEquals(Duration.ofSeconds(15), loop.leaseTtl());
    }

    @Test
    void startAndStopReleasesLease() throws Exception {
        SchedulerLoop loop = new SchedulerLoop(scheduler, locks,
                config(true).withTickInterval(Duration.ofMillis(50)), "scheduler-a");

        loop.start();
        assertTrue(loop.isRunning());
        long deadline = System.currentTimeMillis() + 5_000;
        while (loop.lastReport() == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertNotNull(loop.lastReport());

        loop.stop();
        assertFalse(loop.isRunning());
        assertTrue(locks.holder(SchedulerLoop.LEADER_KEY).isEmpty());
    }
}
