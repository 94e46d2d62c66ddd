package tickwork.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.model.ExecutionResult;
import tickwork.engine.model.ExecutionStatus;
import tickwork.engine.repository.ExecutionResultRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static tickwork.engine.store.Jdbc.setTimestamp;
import static tickwork.engine.store.Jdbc.toInstant;
import static tickwork.engine.store.Jdbc.truncate;

/**
 * JDBC implementation of ExecutionResultRepository.
 * {@link #insert(Connection, ExecutionResult)} joins a caller-owned transaction.
 */
public class JdbcExecutionResultRepository implements ExecutionResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionResultRepository.class);

    private static final int MAX_ERROR_LENGTH = 4096;

    private final Database db;

    public JdbcExecutionResultRepository(Database db) {
        this.db = db;
    }

    public Database database() {
        return db;
    }

    @Override
    public void insert(ExecutionResult result) {
        try (Connection conn = db.getConnection()) {
            try {
                insert(conn, result);
                conn.commit();
            } catch (SQLException e) {
                Jdbc.rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert result for message: " + result.messageId(), e);
        }
    }

    /**
     * Insert without committing.
     */
    public void insert(Connection conn, ExecutionResult result) throws SQLException {
        String sql = """
                    INSERT INTO execution_results (id, message_id, job_id, task_type, queue, attempt, status, terminal,
                                                   output, error, started_at, finished_at, worker_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, result.id());
            ps.setString(2, result.messageId());
            ps.setString(3, result.jobId());
            ps.setString(4, result.taskType());
            ps.setString(5, result.queue());
            ps.setInt(6, result.attempt());
            ps.setString(7, result.status().name());
            ps.setBoolean(8, result.terminal());
            ps.setString(9, result.output());
            ps.setString(10, Jdbc.truncateText(result.error(), MAX_ERROR_LENGTH));
            setTimestamp(ps, 11, truncate(result.startedAt()));
            setTimestamp(ps, 12, truncate(result.finishedAt()));
            ps.setString(13, result.workerId());
            ps.executeUpdate();
        }

        log.debug("Recorded {} for message {} attempt {}", result.status(), result.messageId(), result.attempt());
    }

    @Override
    public List<ExecutionResult> findByJobId(String jobId, int limit) {
        String sql = """
                    SELECT * FROM execution_results
                    WHERE job_id = ?
                    ORDER BY finished_at DESC, attempt DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find results for job: " + jobId, e);
        }
    }

    @Override
    public List<ExecutionResult> findByMessageId(String messageId) {
        String sql = "SELECT * FROM execution_results WHERE message_id = ? ORDER BY attempt, finished_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, messageId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find results for message: " + messageId, e);
        }
    }

    @Override
    public List<ExecutionResult> findRecent(int limit) {
        String sql = "SELECT * FROM execution_results ORDER BY finished_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find recent results", e);
        }
    }

    @Override
    public List<ExecutionResult> findTerminalFailures(int limit) {
        String sql = """
                    SELECT * FROM execution_results
                    WHERE terminal = TRUE AND status <> 'SUCCESS'
                    ORDER BY finished_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find terminal failures", e);
        }
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        String sql = "DELETE FROM execution_results WHERE finished_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.info("Purged {} execution results finished before {}", deleted, cutoff);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to purge execution results", e);
        }
    }

    // --- Helpers ---

    private List<ExecutionResult> executeQuery(PreparedStatement ps) throws SQLException {
        List<ExecutionResult> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private ExecutionResult mapRow(ResultSet rs) throws SQLException {
        return ExecutionResult.builder()
                .id(rs.getString("id"))
                .messageId(rs.getString("message_id"))
                .jobId(rs.getString("job_id"))
                .taskType(rs.getString("task_type"))
                .queue(rs.getString("queue"))
                .attempt(rs.getInt("attempt"))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .terminal(rs.getBoolean("terminal"))
                .output(rs.getString("output"))
                .error(rs.getString("error"))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .workerId(rs.getString("worker_id"))
                .build();
    }
}
