package tickwork.engine.broker;

/**
 * Point-in-time counts for one queue.
 *
 * @param ready    visible and dequeueable now
 * @param inFlight delivered, waiting for settlement
 * @param delayed  handed back for retry, not visible yet
 */
public record QueueStats(String queue, int ready, int inFlight, int delayed) {

    public int total() {
        return ready + inFlight + delayed;
    }
}
