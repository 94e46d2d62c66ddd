package tickwork.engine.repository;

import tickwork.engine.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for job definitions.
 * Advancing {@code next_run} is a row-level compare-and-set so that two scheduler
 * instances never both advance the same occurrence.
 */
public interface JobRepository {

    void save(Job job);

    Optional<Job> findById(String jobId);

    List<Job> findAll();

    /**
     * Enabled jobs with {@code next_run <= now}, oldest first.
     */
    List<Job> findDue(Instant now, int limit);

    /**
     * Move {@code next_run} forward if it still equals {@code expectedNextRun}.
     *
     * @return true if this caller advanced the row
     */
    boolean advanceNextRun(String jobId, Instant expectedNextRun, Instant nextRun, Instant lastRun);

    /**
     * Disable a job and remember why.
     */
    boolean disable(String jobId, String reason);

    /**
     * Enable a job, clearing the disabled reason and setting the next run.
     */
    boolean enable(String jobId, Instant nextRun);

    /**
     * Replace schedule, queue and params, and reset the next run.
     */
    boolean update(String jobId, String schedule, String queue, String params, Instant nextRun);

    boolean delete(String jobId);

    int countEnabled();

    String generateId();
}
