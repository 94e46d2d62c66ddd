package tickwork.engine.broker;

import org.junit.jupiter.api.*;
import tickwork.engine.model.AckResult;
import tickwork.engine.model.DeadLetter;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.store.Database;
import tickwork.engine.support.MutableClock;
import tickwork.engine.support.TestDatabases;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcBrokerTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration VISIBILITY = Duration.ofSeconds(30);

    private static Database db;
    private static MutableClock clock;
    private static JdbcBroker broker;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-broker");
        clock = new MutableClock(T);
        broker = new JdbcBroker(db, clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanQueues() throws Exception {
        TestDatabases.clear(db, "queue_messages", "dead_letters");
        clock.set(T);
    }

    private static TaskMessage message(String id, String queue, int maxAttempts) {
        return TaskMessage.builder()
                .id(id)
                .queue(queue)
                .jobId("job-1")
                .taskType("echo")
                .params("{}")
                .enqueuedAt(clock.instant())
                .maxAttempts(maxAttempts)
                .build();
    }

    private static Optional<TaskMessage> next(String... queues) {
        return broker.dequeue(List.of(queues), VISIBILITY);
    }

    @Test
    void deliversInEnqueueOrder() {
        broker.enqueue(message("m1", "default", 3));
        clock.advance(Duration.ofMillis(10));
        broker.enqueue(message("m2", "default", 3));

        assertEquals("m1", next("default").orElseThrow().id());
        assertEquals("m2", next("default").orElseThrow().id());
        assertTrue(next("default").isEmpty());
    }

    @Test
    void honoursQueueOrder() {
        broker.enqueue(message("low", "default", 3));
        clock.advance(Duration.ofMillis(10));
        broker.enqueue(message("high", "celery", 3));

        assertEquals("high", next("celery", "default").orElseThrow().id());
        assertEquals("low", next("celery", "default").orElseThrow().id());
    }

    @Test
    void ignoresQueuesNotPolled() {
        broker.enqueue(message("m1", "periodic", 3));

        assertTrue(next("default").isEmpty());
        assertTrue(next("periodic").isPresent());
    }

    @Test
    void deliveryHidesMessageAndCountsAttempt() {
        broker.enqueue(message("m1", "default", 3));

        TaskMessage delivered = next("default").orElseThrow();

        assertEquals(1, delivered.attempts());
        assertNotNull(delivered.receipt());
        assertTrue(next("default").isEmpty());
    }

    @Test
    void redeliversAfterVisibilityTimeout() {
        broker.enqueue(message("m1", "default", 3));
        TaskMessage first = next("default").orElseThrow();

        clock.advance(Duration.ofSeconds(29));
        assertTrue(next("default").isEmpty());

        clock.advance(Duration.ofSeconds(1));
        TaskMessage second = next("default").orElseThrow();

        assertEquals("m1", second.id());
        assertEquals(2, second.attempts());
        assertNotEquals(first.receipt(), second.receipt());
    }

    @Test
    void staleReceiptCannotSettle() {
        broker.enqueue(message("m1", "default", 3));
        TaskMessage first = next("default").orElseThrow();
        clock.advance(VISIBILITY);
        TaskMessage second = next("default").orElseThrow();

        assertEquals(AckResult.STALE_RECEIPT, broker.ack("m1", first.receipt()));
        assertEquals(AckResult.ACKED, broker.ack("m1", second.receipt()));
        assertEquals(AckResult.NOT_FOUND, broker.ack("m1", second.receipt()));
        assertTrue(broker.find("m1").isEmpty());
    }

    @Test
    void retryDelaysRedelivery() {
        broker.enqueue(message("m1", "default", 3));
        TaskMessage first = next("default").orElseThrow();

        assertEquals(AckResult.ACKED, broker.retry("m1", first.receipt(), Duration.ofSeconds(10), "boom"));
        assertTrue(next("default").isEmpty());

        clock.advance(Duration.ofSeconds(10));
        TaskMessage second = next("default").orElseThrow();
        assertEquals(2, second.attempts());
        assertEquals("boom", second.lastError());
    }

    @Test
    void exhaustedMessageIsNeverRedelivered() {
        broker.enqueue(message("m1", "default", 2));
        next("default").orElseThrow();
        clock.advance(VISIBILITY);
        assertEquals(2, next("default").orElseThrow().attempts());

        clock.advance(VISIBILITY);
        assertTrue(next("default").isEmpty());

        List<TaskMessage> expired = broker.findExpiredExhausted(clock.instant(), 10);
        assertEquals(List.of("m1"), expired.stream().map(TaskMessage::id).toList());
    }

    @Test
    void deadLetterMovesMessage() {
        broker.enqueue(message("m1", "default", 1));
        TaskMessage delivered = next("default").orElseThrow();

        assertEquals(AckResult.ACKED, broker.deadLetter("m1", delivered.receipt(), "gave up"));

        assertTrue(broker.find("m1").isEmpty());
        List<DeadLetter> letters = broker.deadLetters("default", 10);
        assertEquals(1, letters.size());
        assertEquals("m1", letters.get(0).messageId());
        assertEquals(1, letters.get(0).attempts());
        assertEquals("gave up", letters.get(0).error());
        assertEquals(1, broker.deadLetterCount());
        assertTrue(broker.deadLetters("celery", 10).isEmpty());
    }

    @Test
    void deadLetterRequiresCurrentReceipt() {
        broker.enqueue(message("m1", "default", 3));
        next("default").orElseThrow();

        assertEquals(AckResult.STALE_RECEIPT, broker.deadLetter("m1", "not-the-receipt", "x"));
        assertEquals(AckResult.NOT_FOUND, broker.deadLetter("missing", "r", "x"));
        assertEquals(0, broker.deadLetterCount());
    }

    @Test
    void expiredExhaustedMessageIsDeadLetteredOnce() {
        broker.enqueue(message("m1", "default", 1));
        next("default").orElseThrow();
        clock.advance(VISIBILITY);

        TaskMessage lost = broker.findExpiredExhausted(clock.instant(), 10).get(0);

        assertTrue(broker.deadLetterExpired(lost, "worker lost"));
        assertFalse(broker.deadLetterExpired(lost, "worker lost"));
        assertEquals(1, broker.deadLetterCount());
    }

    @Test
    void inFlightMessageIsNotExpired() {
        broker.enqueue(message("m1", "default", 1));
        TaskMessage delivered = next("default").orElseThrow();

        assertTrue(broker.findExpiredExhausted(clock.instant(), 10).isEmpty());
        assertFalse(broker.deadLetterExpired(delivered, "too early"));
    }

    @Test
    void scheduledMessageWaitsForVisibleAt() {
        broker.enqueue(message("m1", "default", 3).toBuilder().visibleAt(T.plusSeconds(60)).build());

        assertTrue(next("default").isEmpty());
        clock.advance(Duration.ofSeconds(60));
        assertTrue(next("default").isPresent());
    }

    @Test
    void statsCountsByState() {
        broker.enqueue(message("ready", "default", 3));
        broker.enqueue(message("flying", "default", 3).toBuilder().enqueuedAt(T.minusSeconds(5)).build());
        broker.enqueue(message("later", "default", 3).toBuilder().visibleAt(T.plusSeconds(60)).build());

        TaskMessage delivered = next("default").orElseThrow();
        assertEquals("flying", delivered.id());

        QueueStats stats = broker.stats("default");
        assertEquals(1, stats.ready());
        assertEquals(1, stats.inFlight());
        assertEquals(1, stats.delayed());
        assertEquals(3, stats.total());

        assertEquals(0, broker.stats("emails").total());
    }

    @Test
    void healthyWhenReachable() {
        assertTrue(broker.isHealthy());
    }
}
