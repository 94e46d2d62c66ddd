package tickwork.engine.service;

import tickwork.engine.broker.Broker;
import tickwork.engine.broker.QueueStats;
import tickwork.engine.model.DeadLetter;
import tickwork.engine.model.ExecutionResult;
import tickwork.engine.repository.ExecutionResultRepository;

import java.util.List;
import java.util.Optional;

/**
 * Read access to execution outcomes for inspection.
 */
public class ResultService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;

    private final ExecutionResultRepository results;
    private final Broker broker;

    public ResultService(ExecutionResultRepository results, Broker broker) {
        this.results = results;
        this.broker = broker;
    }

    public List<ExecutionResult> resultsForJob(String jobId, int limit) {
        return results.findByJobId(jobId, clamp(limit));
    }

    public List<ExecutionResult> attemptsForMessage(String messageId) {
        return results.findByMessageId(messageId);
    }

    /** The final result of a message, if it has one yet. */
    public Optional<ExecutionResult> finalResult(String messageId) {
        return results.findByMessageId(messageId).stream()
                .filter(ExecutionResult::terminal)
                .reduce((first, second) -> second);
    }

    public List<ExecutionResult> recent(int limit) {
        return results.findRecent(clamp(limit));
    }

    public List<ExecutionResult> terminalFailures(int limit) {
        return results.findTerminalFailures(clamp(limit));
    }

    public List<DeadLetter> deadLetters(String queue, int limit) {
        return broker.deadLetters(queue, clamp(limit));
    }

    public QueueStats queueStats(String queue) {
        return broker.stats(queue);
    }

    static int clamp(int limit) {
        if (limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
