package tickwork.engine.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import tickwork.engine.registry.TaskContext;
import tickwork.engine.util.Json;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EchoTaskTest {

    private static TaskContext ctx(int attempt) {
        return new TaskContext("msg-1", "job-1", EchoTask.TYPE, EchoTask.QUEUE, attempt, 3, "worker-1",
                Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void echoesParams() throws Exception {
        JsonNode output = new EchoTask().execute(Json.parse("{\"hello\":\"world\"}"), ctx(1));

        assertEquals("world", output.path("params").path("hello").asText());
        assertEquals(1, output.get("attempt").asInt());
        assertEquals("worker-1", output.get("worker").asText());
    }

    @Test
    void failsOnRequest() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new EchoTask().execute(Json.parse("{\"fail\":\"boom\"}"), ctx(1)));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void failsUntilAttempt() throws Exception {
        JsonNode params = Json.parse("{\"failUntilAttempt\":3}");

        assertThrows(IllegalStateException.class, () -> new EchoTask().execute(params, ctx(2)));
        assertEquals(3, new EchoTask().execute(params, ctx(3)).get("attempt").asInt());
    }
}
