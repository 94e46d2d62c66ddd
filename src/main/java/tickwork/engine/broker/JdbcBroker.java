package tickwork.engine.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.model.AckResult;
import tickwork.engine.model.DeadLetter;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.store.Database;
import tickwork.engine.store.Jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static tickwork.engine.store.Jdbc.setTimestamp;
import static tickwork.engine.store.Jdbc.toInstant;
import static tickwork.engine.store.Jdbc.truncate;

/**
 * JDBC implementation of Broker.
 *
 * <p>Deliveries are claimed with a compare-and-set on the row version, so two
 * workers racing for the same message never both get it.
 */
public class JdbcBroker implements Broker {

    private static final Logger log = LoggerFactory.getLogger(JdbcBroker.class);

    /** Candidates examined per queue before moving to the next one. */
    private static final int CLAIM_CANDIDATES = 5;
    private static final int MAX_ERROR_LENGTH = 2048;

    private final Database db;
    private final Clock clock;

    public JdbcBroker(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcBroker(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    public Database database() {
        return db;
    }

    @Override
    public void enqueue(TaskMessage message) {
        String sql = """
                    INSERT INTO queue_messages (id, queue, job_id, task_type, params, enqueued_at, visible_at,
                                                attempts, max_attempts, version)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = now();
            Instant enqueuedAt = message.enqueuedAt() != null ? truncate(message.enqueuedAt()) : now;
            ps.setString(1, message.id());
            ps.setString(2, message.queue());
            ps.setString(3, message.jobId());
            ps.setString(4, message.taskType());
            ps.setString(5, message.params());
            setTimestamp(ps, 6, enqueuedAt);
            setTimestamp(ps, 7, message.visibleAt() != null ? truncate(message.visibleAt()) : enqueuedAt);
            ps.setInt(8, message.attempts());
            ps.setInt(9, message.maxAttempts());

            ps.executeUpdate();
            conn.commit();

            log.debug("Enqueued {} on {}", message.id(), message.queue());
        } catch (SQLException e) {
            throw new BrokerException("Failed to enqueue message " + message.id() + " on " + message.queue(), e);
        }
    }

    @Override
    public Optional<TaskMessage> dequeue(List<String> queues, Duration visibilityTimeout) {
        String selectSql = """
                    SELECT id, version FROM queue_messages
                    WHERE queue = ? AND visible_at <= ? AND attempts < max_attempts
                    ORDER BY enqueued_at, id
                    LIMIT ?
                """;

        String claimSql = """
                    UPDATE queue_messages
                    SET visible_at = ?, attempts = attempts + 1, receipt = ?, delivered_at = ?, version = version + 1
                    WHERE id = ? AND version = ? AND visible_at <= ? AND attempts < max_attempts
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement claimPs = conn.prepareStatement(claimSql)) {

                Instant now = now();
                Instant hiddenUntil = truncate(now.plus(visibilityTimeout));

                for (String queue : queues) {
                    List<Candidate> candidates = new ArrayList<>();
                    selectPs.setString(1, queue);
                    setTimestamp(selectPs, 2, now);
                    selectPs.setInt(3, CLAIM_CANDIDATES);
                    try (ResultSet rs = selectPs.executeQuery()) {
                        while (rs.next()) {
                            candidates.add(new Candidate(rs.getString("id"), rs.getLong("version")));
                        }
                    }

                    for (Candidate candidate : candidates) {
                        String receipt = UUID.randomUUID().toString();
                        setTimestamp(claimPs, 1, hiddenUntil);
                        claimPs.setString(2, receipt);
                        setTimestamp(claimPs, 3, now);
                        claimPs.setString(4, candidate.id());
                        claimPs.setLong(5, candidate.version());
                        setTimestamp(claimPs, 6, now);

                        if (claimPs.executeUpdate() == 1) {
                            Optional<TaskMessage> claimed = find(conn, candidate.id());
                            conn.commit();
                            claimed.ifPresent(m -> log.debug("Delivered {} from {} (attempt {}/{})",
                                    m.id(), queue, m.attempts(), m.maxAttempts()));
                            return claimed;
                        }
                    }
                }

                conn.commit();
                return Optional.empty();
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerException("Failed to dequeue from " + queues, e);
        }
    }

    @Override
    public AckResult ack(String messageId, String receipt) {
        try (Connection conn = db.getConnection()) {
            try {
                AckResult result = ack(conn, messageId, receipt);
                conn.commit();
                return result;
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerException("Failed to ack message " + messageId, e);
        }
    }

    /**
     * Ack without committing.
     */
    public AckResult ack(Connection conn, String messageId, String receipt) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM queue_messages WHERE id = ? AND receipt = ?")) {
            ps.setString(1, messageId);
            ps.setString(2, receipt);
            return ps.executeUpdate() > 0 ? AckResult.ACKED : missOutcome(conn, messageId);
        }
    }

    @Override
    public AckResult retry(String messageId, String receipt, Duration delay, String error) {
        try (Connection conn = db.getConnection()) {
            try {
                AckResult result = retry(conn, messageId, receipt, delay, error);
                conn.commit();
                return result;
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerException("Failed to release message " + messageId + " for retry", e);
        }
    }

    /**
     * Release for retry without committing.
     */
    public AckResult retry(Connection conn, String messageId, String receipt, Duration delay, String error)
            throws SQLException {
        String sql = """
                    UPDATE queue_messages
                    SET visible_at = ?, receipt = NULL, last_error = ?, version = version + 1
                    WHERE id = ? AND receipt = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, truncate(now().plus(delay)));
            ps.setString(2, Jdbc.truncateText(error, MAX_ERROR_LENGTH));
            ps.setString(3, messageId);
            ps.setString(4, receipt);
            return ps.executeUpdate() > 0 ? AckResult.ACKED : missOutcome(conn, messageId);
        }
    }

    @Override
    public AckResult deadLetter(String messageId, String receipt, String error) {
        try (Connection conn = db.getConnection()) {
            try {
                AckResult result = deadLetter(conn, messageId, receipt, error);
                conn.commit();
                return result;
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerException("Failed to dead-letter message " + messageId, e);
        }
    }

    /**
     * Dead-letter without committing. Nothing is written unless the result is ACKED.
     */
    public AckResult deadLetter(Connection conn, String messageId, String receipt, String error)
            throws SQLException {
        Optional<TaskMessage> current = find(conn, messageId);
        if (current.isEmpty()) {
            return AckResult.NOT_FOUND;
        }
        if (!receipt.equals(current.get().receipt())) {
            return AckResult.STALE_RECEIPT;
        }

        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM queue_messages WHERE id = ? AND receipt = ?")) {
            ps.setString(1, messageId);
            ps.setString(2, receipt);
            if (ps.executeUpdate() == 0) {
                return AckResult.STALE_RECEIPT;
            }
        }
        insertDeadLetter(conn, current.get(), error);

        log.warn("Message {} dead-lettered after {} attempts: {}", messageId, current.get().attempts(), error);
        return AckResult.ACKED;
    }

    @Override
    public List<TaskMessage> findExpiredExhausted(Instant now, int limit) {
        String sql = """
                    SELECT * FROM queue_messages
                    WHERE visible_at <= ? AND attempts >= max_attempts
                    ORDER BY visible_at
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setInt(2, limit);
            List<TaskMessage> messages = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    messages.add(mapRow(rs));
                }
            }
            conn.commit();
            return messages;
        } catch (SQLException e) {
            throw new BrokerException("Failed to find expired messages", e);
        }
    }

    @Override
    public boolean deadLetterExpired(TaskMessage message, String error) {
        try (Connection conn = db.getConnection()) {
            try {
                boolean moved = deadLetterExpired(conn, message, error);
                conn.commit();
                return moved;
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerException("Failed to dead-letter expired message " + message.id(), e);
        }
    }

    /**
     * Dead-letter an expired, exhausted message without committing.
     */
    public boolean deadLetterExpired(Connection conn, TaskMessage message, String error) throws SQLException {
        String deleteSql = """
                    DELETE FROM queue_messages
                    WHERE id = ? AND visible_at <= ? AND attempts >= max_attempts
                """;

        try (PreparedStatement ps = conn.prepareStatement(deleteSql)) {
            ps.setString(1, message.id());
            setTimestamp(ps, 2, now());
            if (ps.executeUpdate() == 0) {
                return false;
            }
        }
        insertDeadLetter(conn, message, error);

        log.warn("Message {} dead-lettered: {}", message.id(), error);
        return true;
    }

    @Override
    public Optional<TaskMessage> find(String messageId) {
        try (Connection conn = db.getConnection()) {
            Optional<TaskMessage> message = find(conn, messageId);
            conn.commit();
            return message;
        } catch (SQLException e) {
            throw new BrokerException("Failed to find message " + messageId, e);
        }
    }

    @Override
    public QueueStats stats(String queue) {
        String sql = """
                    SELECT
                        SUM(CASE WHEN visible_at <= ? AND attempts < max_attempts THEN 1 ELSE 0 END) AS ready,
                        SUM(CASE WHEN visible_at > ? AND receipt IS NOT NULL THEN 1 ELSE 0 END) AS in_flight,
                        SUM(CASE WHEN visible_at > ? AND receipt IS NULL THEN 1 ELSE 0 END) AS delayed
                    FROM queue_messages
                    WHERE queue = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = now();
            setTimestamp(ps, 1, now);
            setTimestamp(ps, 2, now);
            setTimestamp(ps, 3, now);
            ps.setString(4, queue);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return new QueueStats(queue, rs.getInt("ready"), rs.getInt("in_flight"), rs.getInt("delayed"));
                }
            }
            return new QueueStats(queue, 0, 0, 0);
        } catch (SQLException e) {
            throw new BrokerException("Failed to read stats for queue " + queue, e);
        }
    }

    @Override
    public List<DeadLetter> deadLetters(String queue, int limit) {
        String sql = """
                    SELECT * FROM dead_letters
                    WHERE queue = ?
                    ORDER BY dead_lettered_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue);
            ps.setInt(2, limit);
            List<DeadLetter> letters = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    letters.add(new DeadLetter(
                            rs.getString("message_id"),
                            rs.getString("queue"),
                            rs.getString("job_id"),
                            rs.getString("task_type"),
                            rs.getString("params"),
                            rs.getInt("attempts"),
                            rs.getString("error"),
                            toInstant(rs.getTimestamp("enqueued_at")),
                            toInstant(rs.getTimestamp("dead_lettered_at"))));
                }
            }
            return letters;
        } catch (SQLException e) {
            throw new BrokerException("Failed to list dead letters for " + queue, e);
        }
    }

    @Override
    public int deadLetterCount() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM dead_letters");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new BrokerException("Failed to count dead letters", e);
        }
    }

    @Override
    public boolean isHealthy() {
        return db.isHealthy();
    }

    // --- Helpers ---

    private AckResult missOutcome(Connection conn, String messageId) throws SQLException {
        Optional<TaskMessage> current = find(conn, messageId);
        if (current.isEmpty()) {
            log.debug("Message {} already settled", messageId);
            return AckResult.NOT_FOUND;
        }
        log.warn("Stale receipt for message {}: it was redelivered (attempt {})", messageId, current.get().attempts());
        return AckResult.STALE_RECEIPT;
    }

    private void insertDeadLetter(Connection conn, TaskMessage message, String error) throws SQLException {
        String sql = """
                    INSERT INTO dead_letters (message_id, queue, job_id, task_type, params, attempts, error,
                                              enqueued_at, dead_lettered_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, message.id());
            ps.setString(2, message.queue());
            ps.setString(3, message.jobId());
            ps.setString(4, message.taskType());
            ps.setString(5, message.params());
            ps.setInt(6, message.attempts());
            ps.setString(7, Jdbc.truncateText(error, MAX_ERROR_LENGTH));
            setTimestamp(ps, 8, message.enqueuedAt());
            setTimestamp(ps, 9, now());
            ps.executeUpdate();
        }
    }

    private Optional<TaskMessage> find(Connection conn, String messageId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM queue_messages WHERE id = ?")) {
            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    private TaskMessage mapRow(ResultSet rs) throws SQLException {
        return TaskMessage.builder()
                .id(rs.getString("id"))
                .queue(rs.getString("queue"))
                .jobId(rs.getString("job_id"))
                .taskType(rs.getString("task_type"))
                .params(rs.getString("params"))
                .enqueuedAt(toInstant(rs.getTimestamp("enqueued_at")))
                .visibleAt(toInstant(rs.getTimestamp("visible_at")))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .receipt(rs.getString("receipt"))
                .lastError(rs.getString("last_error"))
                .build();
    }

    private Instant now() {
        return truncate(clock.instant());
    }

    private record Candidate(String id, long version) {
    }
}
