package tickwork.engine.repository;

import tickwork.engine.model.ExecutionResult;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for execution results. Results are append-only.
 */
public interface ExecutionResultRepository {

    void insert(ExecutionResult result);

    List<ExecutionResult> findByJobId(String jobId, int limit);

    /** All attempts of one message, in attempt order. */
    List<ExecutionResult> findByMessageId(String messageId);

    List<ExecutionResult> findRecent(int limit);

    /** Terminal results whose status is not SUCCESS, newest first. */
    List<ExecutionResult> findTerminalFailures(int limit);

    /**
     * Delete results that finished before the cutoff.
     *
     * @return number of rows removed
     */
    int deleteFinishedBefore(Instant cutoff);
}
