package tickwork.engine.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import tickwork.engine.registry.TaskCapability;
import tickwork.engine.registry.TaskContext;
import tickwork.engine.util.Json;

/**
 * Diagnostic task: returns its params.
 *
 * <p>Optional params: {@code sleepMs} waits before returning, {@code fail}
 * throws with the given message, {@code failUntilAttempt} fails every attempt
 * below that number.
 */
public class EchoTask implements TaskCapability {

    public static final String TYPE = "echo";
    public static final String QUEUE = "default";

    @Override
    public JsonNode execute(JsonNode params, TaskContext ctx) throws Exception {
        long sleepMs = params.path("sleepMs").asLong(0);
        if (sleepMs > 0) {
            Thread.sleep(sleepMs);
        }
        if (params.hasNonNull("fail")) {
            throw new IllegalStateException(params.get("fail").asText());
        }
        int failUntil = params.path("failUntilAttempt").asInt(0);
        if (ctx.attempt() < failUntil) {
            throw new IllegalStateException("failing attempt " + ctx.attempt() + " of " + failUntil);
        }

        ObjectNode output = Json.object();
        output.set("params", params);
        output.put("attempt", ctx.attempt());
        output.put("worker", ctx.workerId());
        return output;
    }
}
