package tickwork.engine.scheduler;

import java.time.Instant;

/**
 * A parsed job schedule.
 */
public interface Schedule {

    /**
     * First run of a newly created or re-enabled job.
     */
    Instant initialRun(Instant now);

    /**
     * Next run after a job fired. The result is strictly greater than both
     * {@code previous} and {@code now}; runs missed in between are skipped.
     *
     * @param previous the next-run value the job was fired for
     */
    Instant nextRun(Instant previous, Instant now);

    /** Normalized expression. */
    String expression();
}
