package tickwork.engine.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.registry.TaskCapability;
import tickwork.engine.registry.TaskContext;
import tickwork.engine.repository.ExecutionResultRepository;
import tickwork.engine.util.Json;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes execution results older than the retention period. A
 * {@code retention} param (e.g. {@code "3d"}) overrides the configured one.
 */
public class PurgeExecutionResultsTask implements TaskCapability {

    private static final Logger log = LoggerFactory.getLogger(PurgeExecutionResultsTask.class);

    public static final String TYPE = "purge_execution_results";
    public static final String QUEUE = "periodic";

    private final ExecutionResultRepository results;
    private final Duration retention;
    private final Clock clock;

    public PurgeExecutionResultsTask(ExecutionResultRepository results, Duration retention, Clock clock) {
        this.results = results;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public JsonNode execute(JsonNode params, TaskContext ctx) {
        Duration keep = params.hasNonNull("retention")
                ? EngineConfig.parseDuration(params.get("retention").asText())
                : retention;
        Instant cutoff = clock.instant().minus(keep);
        int deleted = results.deleteFinishedBefore(cutoff);
        log.info("Purged {} execution results finished before {}", deleted, cutoff);

        ObjectNode output = Json.object();
        output.put("deleted", deleted);
        output.put("cutoff", cutoff.toString());
        return output;
    }
}
