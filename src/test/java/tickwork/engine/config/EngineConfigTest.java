package tickwork.engine.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void defaultsMatchReferenceDeployment() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(List.of("queries", "scheduled_queries", "schemas", "periodic", "emails", "default"),
                config.queues().names());
        assertEquals(4, config.workersCount());
        assertEquals(3, config.maxAttempts());
        assertEquals(Duration.ofSeconds(5), config.tickInterval());
        assertEquals(Duration.ofMinutes(5), config.taskTimeout());
        assertEquals(Duration.ofMinutes(10), config.visibilityTimeout());
        assertEquals(Duration.ofMinutes(15), config.lockTtl());
        assertTrue(config.leaderLease());
        assertTrue(config.sharedBrokerDatabase());
        assertEquals(config.databaseUrl(), config.brokerUrl());
    }

    @Test
    void readsEnvironment() {
        EngineConfig config = EngineConfig.fromEnv(Map.of(
                "TICKWORK_DATABASE_URL", "jdbc:postgresql://db/tickwork",
                "TICKWORK_BROKER_URL", "jdbc:postgresql://broker/tickwork",
                "QUEUES", "queries,scheduled_queries",
                "WORKERS_COUNT", "8",
                "TICKWORK_MAX_ATTEMPTS", "5",
                "TICKWORK_TICK_INTERVAL", "2s",
                "TICKWORK_VISIBILITY_TIMEOUT", "PT30S",
                "TICKWORK_LEADER_LEASE", "false",
                "TICKWORK_OPS_PORT", "0"));

        assertEquals("jdbc:postgresql://db/tickwork", config.databaseUrl());
        assertEquals("jdbc:postgresql://broker/tickwork", config.brokerUrl());
        assertFalse(config.sharedBrokerDatabase());
        assertEquals(List.of("queries", "scheduled_queries"), config.queues().names());
        assertEquals(8, config.workersCount());
        assertEquals(5, config.maxAttempts());
        assertEquals(Duration.ofSeconds(2), config.tickInterval());
        assertEquals(Duration.ofSeconds(30), config.visibilityTimeout());
        assertFalse(config.leaderLease());
        assertFalse(config.opsEnabled());
    }

    @Test
    void blankVariablesKeepDefaults() {
        EngineConfig config = EngineConfig.fromEnv(Map.of("WORKERS_COUNT", " ", "QUEUES", ""));

        assertEquals(4, config.workersCount());
        assertEquals(6, config.queues().size());
    }

    @Test
    void parsesDurations() {
        assertEquals(Duration.ofMillis(500), EngineConfig.parseDuration("500ms"));
        assertEquals(Duration.ofSeconds(30), EngineConfig.parseDuration("30s"));
        assertEquals(Duration.ofSeconds(45), EngineConfig.parseDuration("45"));
        assertEquals(Duration.ofMinutes(5), EngineConfig.parseDuration("5m"));
        assertEquals(Duration.ofHours(2), EngineConfig.parseDuration("2h"));
        assertEquals(Duration.ofDays(7), EngineConfig.parseDuration("7d"));
        assertEquals(Duration.ofMinutes(15), EngineConfig.parseDuration("PT15M"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.parseDuration("5x"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.parseDuration(""));
    }

    @Test
    void validateRejectsNonPositiveSettings() {
        assertThrows(IllegalStateException.class, () -> EngineConfig.defaults().withWorkersCount(0).validate());
        assertThrows(IllegalStateException.class, () -> EngineConfig.defaults().withMaxAttempts(0).validate());
        assertThrows(IllegalStateException.class,
                () -> EngineConfig.defaults().withTickInterval(Duration.ZERO).validate());
        assertThrows(IllegalStateException.class, () -> EngineConfig.defaults().withOpsPort(70000).validate());
    }

    @Test
    void validateRejectsTaskTimeoutReachingVisibility() {
        assertThrows(IllegalStateException.class, () -> EngineConfig.defaults()
                .withTaskTimeout(Duration.ofMinutes(10))
                .withVisibilityTimeout(Duration.ofMinutes(10))
                .validate());
        assertThrows(IllegalStateException.class, () -> EngineConfig.defaults()
                .withVisibilityTimeout(Duration.ofSeconds(30))
                .validate());
        assertDoesNotThrow(() -> EngineConfig.defaults()
                .withTaskTimeout(Duration.ofSeconds(29))
                .withVisibilityTimeout(Duration.ofSeconds(30))
                .validate());
    }

    @Test
    void fluentSettersChain() {
        EngineConfig config = EngineConfig.defaults()
                .withQueues(QueueBinding.of("emails"))
                .withWorkersCount(2)
                .withTaskTimeout(Duration.ofSeconds(1))
                .validate();

        assertEquals("emails", config.queues().toString());
        assertEquals(2, config.workersCount());
        assertEquals(Duration.ofSeconds(1), config.taskTimeout());
    }
}
