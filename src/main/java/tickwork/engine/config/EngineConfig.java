package tickwork.engine.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for scheduler and worker processes.
 * All settings have sensible defaults and can be overridden from the environment.
 */
public final class EngineConfig {

    public static final String DEFAULT_QUEUES = "queries scheduled_queries schemas periodic emails default";

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/tickwork;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private String brokerUrl = null; // null = same database as the store
    private int databasePoolSize = 10;

    // Worker settings
    private QueueBinding queues = QueueBinding.parse(DEFAULT_QUEUES);
    private int workersCount = 4;
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration taskTimeout = Duration.ofMinutes(5);
    private Duration shutdownGrace = Duration.ofSeconds(30);

    // Broker settings
    private Duration visibilityTimeout = Duration.ofMinutes(10);
    private int maxAttempts = 3;
    private Duration retryBackoff = Duration.ofSeconds(10);
    private Duration maxRetryBackoff = Duration.ofMinutes(5);
    private Duration lockTtl = Duration.ofMinutes(15);
    private Duration reaperInterval = Duration.ofSeconds(30);

    // Scheduler settings
    private Duration tickInterval = Duration.ofSeconds(5);
    private boolean leaderLease = true;

    // Ops server
    private int opsPort = 8081;
    private String opsHost = "0.0.0.0";

    // Built-in tasks
    private Duration resultRetention = Duration.ofDays(7);

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static EngineConfig fromEnv(Map<String, String> env) {
        EngineConfig config = new EngineConfig();

        String dbUrl = env.get("TICKWORK_DATABASE_URL");
        if (isSet(dbUrl)) {
            config.databaseUrl = dbUrl.trim();
        }

        String brokerUrl = env.get("TICKWORK_BROKER_URL");
        if (isSet(brokerUrl)) {
            config.brokerUrl = brokerUrl.trim();
        }

        String poolSize = env.get("TICKWORK_DB_POOL_SIZE");
        if (isSet(poolSize)) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String queues = env.get("QUEUES");
        if (isSet(queues)) {
            config.queues = QueueBinding.parse(queues);
        }

        String workers = env.get("WORKERS_COUNT");
        if (isSet(workers)) {
            config.workersCount = Integer.parseInt(workers.trim());
        }

        String maxAttempts = env.get("TICKWORK_MAX_ATTEMPTS");
        if (isSet(maxAttempts)) {
            config.maxAttempts = Integer.parseInt(maxAttempts.trim());
        }

        String opsPort = env.get("TICKWORK_OPS_PORT");
        if (isSet(opsPort)) {
            config.opsPort = Integer.parseInt(opsPort.trim());
        }

        String leader = env.get("TICKWORK_LEADER_LEASE");
        if (isSet(leader)) {
            config.leaderLease = Boolean.parseBoolean(leader.trim());
        }

        config.tickInterval = durationOr(env, "TICKWORK_TICK_INTERVAL", config.tickInterval);
        config.taskTimeout = durationOr(env, "TICKWORK_TASK_TIMEOUT", config.taskTimeout);
        config.visibilityTimeout = durationOr(env, "TICKWORK_VISIBILITY_TIMEOUT", config.visibilityTimeout);
        config.lockTtl = durationOr(env, "TICKWORK_LOCK_TTL", config.lockTtl);
        config.pollInterval = durationOr(env, "TICKWORK_POLL_INTERVAL", config.pollInterval);
        config.retryBackoff = durationOr(env, "TICKWORK_RETRY_BACKOFF", config.retryBackoff);
        config.shutdownGrace = durationOr(env, "TICKWORK_SHUTDOWN_GRACE", config.shutdownGrace);
        config.resultRetention = durationOr(env, "TICKWORK_RESULT_RETENTION", config.resultRetention);

        return config;
    }

    /**
     * Check invariants between settings.
     *
     * @throws IllegalStateException if a setting is out of range
     */
    public EngineConfig validate() {
        requirePositive(databasePoolSize, "databasePoolSize");
        requirePositive(workersCount, "workersCount");
        requirePositive(maxAttempts, "maxAttempts");
        requirePositive(tickInterval, "tickInterval");
        requirePositive(taskTimeout, "taskTimeout");
        requirePositive(visibilityTimeout, "visibilityTimeout");
        requirePositive(lockTtl, "lockTtl");
        requirePositive(pollInterval, "pollInterval");
        if (retryBackoff.isNegative()) {
            throw new IllegalStateException("retryBackoff must not be negative");
        }
        if (opsPort < 0 || opsPort > 65535) {
            throw new IllegalStateException("opsPort out of range: " + opsPort);
        }

        if (visibilityTimeout.compareTo(taskTimeout) <= 0) {
            throw new IllegalStateException("visibilityTimeout " + visibilityTimeout
                    + " must exceed taskTimeout " + taskTimeout);
        }
        return this;
    }

    /**
     * Parse a duration setting. Accepts ISO-8601 ({@code PT30S}), a number with a
     * unit suffix ({@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h}, {@code 7d})
     * or a bare number of seconds.
     */
    public static Duration parseDuration(String value) {
        String s = value.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("duration is empty");
        }
        if (s.startsWith("pt") || s.startsWith("p")) {
            return Duration.parse(s.toUpperCase(Locale.ROOT));
        }
        try {
            if (s.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(s.substring(0, s.length() - 2).trim()));
            }
            char unit = s.charAt(s.length() - 1);
            if (Character.isDigit(unit)) {
                return Duration.ofSeconds(Long.parseLong(s));
            }
            long amount = Long.parseLong(s.substring(0, s.length() - 1).trim());
            return switch (unit) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                default -> throw new IllegalArgumentException("unknown duration unit '" + unit + "' in " + value);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid duration: " + value, e);
        }
    }

    private static Duration durationOr(Map<String, String> env, String name, Duration fallback) {
        String value = env.get(name);
        if (!isSet(value)) {
            return fallback;
        }
        return parseDuration(value);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalStateException(name + " must be positive, got " + value);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(name + " must be positive, got " + value);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    /** Broker JDBC URL; falls back to the store URL. */
    public String brokerUrl() {
        return brokerUrl != null ? brokerUrl : databaseUrl;
    }

    /** True when broker tables live in the store database (single pool, atomic result + lock). */
    public boolean sharedBrokerDatabase() {
        return brokerUrl().equals(databaseUrl);
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public QueueBinding queues() {
        return queues;
    }

    public int workersCount() {
        return workersCount;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public Duration shutdownGrace() {
        return shutdownGrace;
    }

    public Duration visibilityTimeout() {
        return visibilityTimeout;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration retryBackoff() {
        return retryBackoff;
    }

    public Duration maxRetryBackoff() {
        return maxRetryBackoff;
    }

    public Duration lockTtl() {
        return lockTtl;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public boolean leaderLease() {
        return leaderLease;
    }

    public int opsPort() {
        return opsPort;
    }

    public String opsHost() {
        return opsHost;
    }

    public boolean opsEnabled() {
        return opsPort > 0;
    }

    public Duration resultRetention() {
        return resultRetention;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withBrokerUrl(String url) {
        this.brokerUrl = url;
        return this;
    }

    public EngineConfig withQueues(QueueBinding queues) {
        this.queues = queues;
        return this;
    }

    public EngineConfig withWorkersCount(int workersCount) {
        this.workersCount = workersCount;
        return this;
    }

    public EngineConfig withPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    public EngineConfig withTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = taskTimeout;
        return this;
    }

    public EngineConfig withShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
        return this;
    }

    public EngineConfig withVisibilityTimeout(Duration visibilityTimeout) {
        this.visibilityTimeout = visibilityTimeout;
        return this;
    }

    public EngineConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public EngineConfig withRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
        return this;
    }

    public EngineConfig withLockTtl(Duration lockTtl) {
        this.lockTtl = lockTtl;
        return this;
    }

    public EngineConfig withReaperInterval(Duration reaperInterval) {
        this.reaperInterval = reaperInterval;
        return this;
    }

    public EngineConfig withTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
        return this;
    }

    public EngineConfig withLeaderLease(boolean leaderLease) {
        this.leaderLease = leaderLease;
        return this;
    }

    public EngineConfig withOpsPort(int port) {
        this.opsPort = port;
        return this;
    }

    public EngineConfig withResultRetention(Duration retention) {
        this.resultRetention = retention;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", brokerShared=" + sharedBrokerDatabase() +
                ", queues=" + queues +
                ", workers=" + workersCount +
                ", tick=" + tickInterval +
                ", taskTimeout=" + taskTimeout +
                ", visibility=" + visibilityTimeout +
                ", maxAttempts=" + maxAttempts +
                ", lockTtl=" + lockTtl +
                ", opsPort=" + opsPort +
                '}';
    }
}
