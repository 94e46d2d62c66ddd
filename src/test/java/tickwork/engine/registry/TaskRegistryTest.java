package tickwork.engine.registry;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tickwork.engine.config.QueueBinding;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskRegistryTest {

    private static final TaskCapability NOOP = (params, ctx) -> TextNode.valueOf("ok");

    private TaskRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TaskRegistry()
                .register("refresh_query", "queries", NOOP)
                .register("send_mail", "emails", NOOP);
    }

    @Test
    void findsRegisteredTasks() {
        assertTrue(registry.find("refresh_query").isPresent());
        assertEquals("emails", registry.require("send_mail").queue());
        assertTrue(registry.find("missing").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertEquals(2, registry.size());
    }

    @Test
    void requireUnknownThrows() {
        UnknownTaskTypeException e = assertThrows(UnknownTaskTypeException.class, () -> registry.require("missing"));
        assertEquals("missing", e.taskType());
    }

    @Test
    void duplicateRegistrationRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("send_mail", "default", NOOP));
    }

    @Test
    void declaredQueuesIncludeDefault() {
        assertEquals(Set.of("default", "queries", "emails"), registry.declaredQueues());
    }

    @Test
    void bindingOfDeclaredQueuesPasses() {
        List<String> unpolled = registry.validateBinding(QueueBinding.of("queries", "default"));

        assertEquals(List.of("emails"), unpolled);
    }

    @Test
    void bindingOfUndeclaredQueueFailsFast() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> registry.validateBinding(QueueBinding.of("queries", "qeueries")));
        assertTrue(e.getMessage().contains("qeueries"));
    }

    @Test
    void standaloneQueuesCanBeDeclared() {
        registry.declareQueues(List.of("schemas"));

        assertTrue(registry.validateBinding(QueueBinding.of("schemas", "queries", "emails")).isEmpty());
    }

    @Test
    void overridesFallBackToDefaults() {
        RegisteredTask plain = RegisteredTask.of("a", "default", NOOP);
        RegisteredTask tuned = plain.withTimeout(Duration.ofSeconds(3)).withMaxAttempts(7);

        assertEquals(Duration.ofMinutes(5), plain.timeoutOr(Duration.ofMinutes(5)));
        assertEquals(3, plain.maxAttemptsOr(3));
        assertEquals(Duration.ofSeconds(3), tuned.timeoutOr(Duration.ofMinutes(5)));
        assertEquals(7, tuned.maxAttemptsOr(3));
    }

    @Test
    void timeoutsMustStayBelowVisibility() {
        registry.register(RegisteredTask.of("export", "default", NOOP).withTimeout(Duration.ofMinutes(30)));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> registry.validateTimeouts(Duration.ofMinutes(5), Duration.ofMinutes(10)));
        assertEquals("Task timeouts [export=PT30M] must be below the visibility timeout PT10M", e.getMessage());

        assertThrows(IllegalStateException.class,
                () -> registry.validateTimeouts(Duration.ofMinutes(40), Duration.ofMinutes(40)));
        assertDoesNotThrow(() -> registry.validateTimeouts(Duration.ofMinutes(5), Duration.ofMinutes(40)));
    }

    @Test
    void registeredTaskValidatesQueueName() {
        assertThrows(IllegalArgumentException.class, () -> RegisteredTask.of("a", "bad queue", NOOP));
    }
}
