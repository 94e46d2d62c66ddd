package tickwork.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a recurring job definition.
 * A job is turned into one TaskMessage each time its schedule comes due.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String taskType;
    private final String schedule; // interval or cron expression
    private final String queue;
    private final String params; // JSON passed to the task capability
    private final boolean enabled;
    private final Instant nextRun;
    private final Instant lastRun;
    private final String disabledReason;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule is required");
        this.queue = builder.queue;
        this.params = builder.params != null ? builder.params : "{}";
        this.enabled = builder.enabled;
        this.nextRun = builder.nextRun;
        this.lastRun = builder.lastRun;
        this.disabledReason = builder.disabledReason;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String taskType() {
        return taskType;
    }

    public String schedule() {
        return schedule;
    }

    public String queue() {
        return queue;
    }

    public String params() {
        return params;
    }

    public boolean enabled() {
        return enabled;
    }

    public Instant nextRun() {
        return nextRun;
    }

    public Instant lastRun() {
        return lastRun;
    }

    public String disabledReason() {
        return disabledReason;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** True if the job is enabled and its next run is at or before {@code now}. */
    public boolean isDue(Instant now) {
        return enabled && nextRun != null && !nextRun.isAfter(now);
    }

    /** Lock key guarding concurrent runs of this job. */
    public String lockKey() {
        return lockKey(id);
    }

    public static String lockKey(String jobId) {
        return "job:" + jobId;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .taskType(taskType)
                .schedule(schedule)
                .queue(queue)
                .params(params)
                .enabled(enabled)
                .nextRun(nextRun)
                .lastRun(lastRun)
                .disabledReason(disabledReason)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String taskType;
        private String schedule;
        private String queue;
        private String params;
        private boolean enabled = true;
        private Instant nextRun;
        private Instant lastRun;
        private String disabledReason;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder params(String params) {
            this.params = params;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder nextRun(Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder disabledReason(String disabledReason) {
            this.disabledReason = disabledReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', taskType='" + taskType + "', schedule='" + schedule
                + "', queue='" + queue + "', enabled=" + enabled + ", nextRun=" + nextRun + "}";
    }
}
