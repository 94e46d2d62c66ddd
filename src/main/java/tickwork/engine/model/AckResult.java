package tickwork.engine.model;

/**
 * Result of settling a delivered message (ack, retry or dead-letter).
 */
public enum AckResult {
    /** Message settled by the current delivery */
    ACKED,

    /**
     * Receipt does not match the current delivery: the visibility window expired
     * and the message was redelivered to someone else
     */
    STALE_RECEIPT,

    /** Message no longer exists (already settled) */
    NOT_FOUND;

    public boolean isAcked() {
        return this == ACKED;
    }
}
