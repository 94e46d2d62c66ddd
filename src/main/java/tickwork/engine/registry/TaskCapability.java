package tickwork.engine.registry;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An executable task addressed by its task-type name.
 *
 * <p>Implementations should be idempotent: a message may be delivered more
 * than once. A thrown exception marks the attempt as failed. Long-running
 * implementations should respond to interruption, which is how the worker
 * enforces the timeout.
 */
@FunctionalInterface
public interface TaskCapability {

    /**
     * @param params task parameters, never null
     * @return output recorded with the result, may be null
     */
    JsonNode execute(JsonNode params, TaskContext ctx) throws Exception;
}
