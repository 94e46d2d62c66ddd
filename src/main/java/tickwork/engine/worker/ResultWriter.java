package tickwork.engine.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.broker.BrokerException;
import tickwork.engine.broker.JdbcBroker;
import tickwork.engine.broker.JdbcLockManager;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.model.AckResult;
import tickwork.engine.model.ExecutionResult;
import tickwork.engine.model.Job;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.store.Database;
import tickwork.engine.store.Jdbc;
import tickwork.engine.store.JdbcExecutionResultRepository;
import tickwork.engine.store.StoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Settles delivered messages with the broker and persists their execution
 * results together with the job lock bookkeeping.
 *
 * <p>The broker is settled first under the delivery receipt. A result is
 * written only when that settlement succeeds, so a delivery that lost its
 * message to redelivery or to the reaper records nothing.
 *
 * <p>The lock of a scheduled job is owned by the message id. A final result
 * releases it, an intermediate one extends it so the job is not rescheduled
 * while retries are pending. When broker and store share a database the
 * settlement, the result and the lock change commit together; otherwise the
 * settlement is committed first, then the result, and the lock TTL covers a
 * crash in between.
 */
public class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    @FunctionalInterface
    private interface Settlement {
        AckResult apply(Connection conn) throws SQLException;
    }

    private final JdbcExecutionResultRepository results;
    private final JdbcBroker broker;
    private final JdbcLockManager locks;
    private final EngineConfig config;
    private final boolean shared;

    public ResultWriter(JdbcExecutionResultRepository results, JdbcBroker broker, JdbcLockManager locks,
            EngineConfig config) {
        this.results = results;
        this.broker = broker;
        this.locks = locks;
        this.config = config;
        this.shared = results.database() == broker.database() && broker.database() == locks.database();
    }

    /** Ack a successful message and record its final result. */
    public AckResult ack(TaskMessage message, ExecutionResult result) {
        return settle(result, true,
                conn -> broker.ack(conn, message.id(), message.receipt()),
                () -> broker.ack(message.id(), message.receipt()));
    }

    /** Hand a failed attempt back for redelivery after {@code delay} and record it. */
    public AckResult retry(TaskMessage message, ExecutionResult result, Duration delay) {
        return settle(result, false,
                conn -> broker.retry(conn, message.id(), message.receipt(), delay, result.error()),
                () -> broker.retry(message.id(), message.receipt(), delay, result.error()));
    }

    /** Dead-letter a message and record its final result. */
    public AckResult deadLetter(TaskMessage message, ExecutionResult result) {
        return settle(result, true,
                conn -> broker.deadLetter(conn, message.id(), message.receipt(), result.error()),
                () -> broker.deadLetter(message.id(), message.receipt(), result.error()));
    }

    /**
     * Dead-letter a message whose final delivery expired and record its final result.
     *
     * @return true if this caller moved the message
     */
    public boolean deadLetterExpired(TaskMessage message, ExecutionResult result) {
        AckResult settled = settle(result, true,
                conn -> broker.deadLetterExpired(conn, message, result.error()) ? AckResult.ACKED : AckResult.NOT_FOUND,
                () -> broker.deadLetterExpired(message, result.error()) ? AckResult.ACKED : AckResult.NOT_FOUND);
        return settled.isAcked();
    }

    public boolean isTransactional() {
        return shared;
    }

    private AckResult settle(ExecutionResult result, boolean terminal, Settlement inTransaction,
            Supplier<AckResult> standalone) {
        ExecutionResult recorded = result.toBuilder().terminal(terminal).build();
        if (!shared) {
            AckResult settled = standalone.get();
            if (settled.isAcked()) {
                writeSeparately(recorded, terminal);
            }
            return settled;
        }

        Database db = results.database();
        try (Connection conn = db.getConnection()) {
            try {
                AckResult settled = inTransaction.apply(conn);
                if (!settled.isAcked()) {
                    conn.rollback();
                    return settled;
                }
                results.insert(conn, recorded);
                String lockKey = lockKey(recorded);
                if (lockKey != null) {
                    boolean held = terminal
                            ? locks.release(conn, lockKey, recorded.messageId())
                            : locks.refresh(conn, lockKey, recorded.messageId(), config.lockTtl());
                    if (!held) {
                        log.debug("Lock {} was not held by {} when recording {}", lockKey, recorded.messageId(),
                                recorded.status());
                    }
                }
                conn.commit();
                return settled;
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to settle message " + recorded.messageId(), e);
        }
    }

    private void writeSeparately(ExecutionResult result, boolean release) {
        results.insert(result);
        String lockKey = lockKey(result);
        if (lockKey == null) {
            return;
        }
        try {
            if (release) {
                locks.release(lockKey, result.messageId());
            } else {
                locks.refresh(lockKey, result.messageId(), config.lockTtl());
            }
        } catch (BrokerException e) {
            log.warn("Result for {} recorded but lock {} not updated, it will expire: {}",
                    result.messageId(), lockKey, e.getMessage());
        }
    }

    private static String lockKey(ExecutionResult result) {
        return result.jobId() != null ? Job.lockKey(result.jobId()) : null;
    }
}
