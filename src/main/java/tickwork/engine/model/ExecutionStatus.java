package tickwork.engine.model;

/**
 * Outcome of a single execution attempt.
 */
public enum ExecutionStatus {
    /** Capability returned normally */
    SUCCESS,
    /** Capability threw, or the message was lost with no attempts left */
    FAILURE,
    /** Capability exceeded its timeout and was interrupted */
    TIMEOUT;

    /** Timeouts count against the retry budget exactly like failures. */
    public boolean isFailure() {
        return this != SUCCESS;
    }
}
