package tickwork.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.model.Job;
import tickwork.engine.repository.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static tickwork.engine.store.Jdbc.setTimestamp;
import static tickwork.engine.store.Jdbc.toInstant;
import static tickwork.engine.store.Jdbc.truncate;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;
    private final Clock clock;

    public JdbcJobRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcJobRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, name, task_type, schedule, queue, params, enabled, next_run, last_run,
                                      disabled_reason, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = truncate(clock.instant());
            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, job.taskType());
            ps.setString(4, job.schedule());
            ps.setString(5, job.queue());
            ps.setString(6, job.params());
            ps.setBoolean(7, job.enabled());
            setTimestamp(ps, 8, truncate(job.nextRun()));
            setTimestamp(ps, 9, truncate(job.lastRun()));
            ps.setString(10, job.disabledReason());
            setTimestamp(ps, 11, job.createdAt() != null ? truncate(job.createdAt()) : now);
            setTimestamp(ps, 12, now);

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new StoreException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findAll() {
        String sql = "SELECT * FROM jobs ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs", e);
        }
    }

    @Override
    public List<Job> findDue(Instant now, int limit) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE enabled = TRUE AND next_run IS NOT NULL AND next_run <= ?
                    ORDER BY next_run, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to select due jobs", e);
        }
    }

    @Override
    public boolean advanceNextRun(String jobId, Instant expectedNextRun, Instant nextRun, Instant lastRun) {
        String sql = """
                    UPDATE jobs
                    SET next_run = ?, last_run = ?, updated_at = ?
                    WHERE id = ? AND next_run = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, truncate(nextRun));
            setTimestamp(ps, 2, truncate(lastRun));
            setTimestamp(ps, 3, truncate(clock.instant()));
            ps.setString(4, jobId);
            setTimestamp(ps, 5, expectedNextRun);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Job {} next_run was advanced concurrently, expected {}", jobId, expectedNextRun);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to advance next run for job: " + jobId, e);
        }
    }

    @Override
    public boolean disable(String jobId, String reason) {
        String sql = """
                    UPDATE jobs SET enabled = FALSE, disabled_reason = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, Jdbc.truncateText(reason, 1024));
            setTimestamp(ps, 2, truncate(clock.instant()));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to disable job: " + jobId, e);
        }
    }

    @Override
    public boolean enable(String jobId, Instant nextRun) {
        String sql = """
                    UPDATE jobs SET enabled = TRUE, disabled_reason = NULL, next_run = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, truncate(nextRun));
            setTimestamp(ps, 2, truncate(clock.instant()));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to enable job: " + jobId, e);
        }
    }

    @Override
    public boolean update(String jobId, String schedule, String queue, String params, Instant nextRun) {
        String sql = """
                    UPDATE jobs SET schedule = ?, queue = ?, params = ?, next_run = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, schedule);
            ps.setString(2, queue);
            ps.setString(3, params);
            setTimestamp(ps, 4, truncate(nextRun));
            setTimestamp(ps, 5, truncate(clock.instant()));
            ps.setString(6, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update job: " + jobId, e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete job: " + jobId, e);
        }
    }

    @Override
    public int countEnabled() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM jobs WHERE enabled = TRUE");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count jobs", e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .taskType(rs.getString("task_type"))
                .schedule(rs.getString("schedule"))
                .queue(rs.getString("queue"))
                .params(rs.getString("params"))
                .enabled(rs.getBoolean("enabled"))
                .nextRun(toInstant(rs.getTimestamp("next_run")))
                .lastRun(toInstant(rs.getTimestamp("last_run")))
                .disabledReason(rs.getString("disabled_reason"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
