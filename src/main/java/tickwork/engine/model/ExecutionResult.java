package tickwork.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable outcome of one delivery attempt of a TaskMessage.
 * Exactly one result is written per attempt; the last one for a message is
 * flagged {@code terminal}.
 */
public final class ExecutionResult {
    private final String id;
    private final String messageId;
    private final String jobId;
    private final String taskType;
    private final String queue;
    private final int attempt;
    private final ExecutionStatus status;
    private final boolean terminal;
    private final String output; // JSON returned by the capability
    private final String error;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String workerId;

    private ExecutionResult(Builder builder) {
        this.id = builder.id != null ? builder.id : newId();
        this.messageId = Objects.requireNonNull(builder.messageId, "messageId is required");
        this.jobId = builder.jobId;
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.queue = builder.queue;
        this.attempt = builder.attempt;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.terminal = builder.terminal;
        this.output = builder.output;
        this.error = builder.error;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.workerId = builder.workerId;
    }

    public String id() {
        return id;
    }

    public String messageId() {
        return messageId;
    }

    public String jobId() {
        return jobId;
    }

    public String taskType() {
        return taskType;
    }

    public String queue() {
        return queue;
    }

    public int attempt() {
        return attempt;
    }

    public ExecutionStatus status() {
        return status;
    }

    public boolean terminal() {
        return terminal;
    }

    public String output() {
        return output;
    }

    public String error() {
        return error;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String workerId() {
        return workerId;
    }

    public Long runtimeMs() {
        if (startedAt == null || finishedAt == null)
            return null;
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public static String newId() {
        return "res-" + UUID.randomUUID();
    }

    /** Start a result for the given delivery of a message. */
    public static Builder forMessage(TaskMessage message) {
        return new Builder()
                .messageId(message.id())
                .jobId(message.jobId())
                .taskType(message.taskType())
                .queue(message.queue())
                .attempt(message.attempts());
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .messageId(messageId)
                .jobId(jobId)
                .taskType(taskType)
                .queue(queue)
                .attempt(attempt)
                .status(status)
                .terminal(terminal)
                .output(output)
                .error(error)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .workerId(workerId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String messageId;
        private String jobId;
        private String taskType;
        private String queue;
        private int attempt;
        private ExecutionStatus status;
        private boolean terminal;
        private String output;
        private String error;
        private Instant startedAt;
        private Instant finishedAt;
        private String workerId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder terminal(boolean terminal) {
            this.terminal = terminal;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public ExecutionResult build() {
            return new ExecutionResult(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExecutionResult that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ExecutionResult{messageId='" + messageId + "', attempt=" + attempt + ", status=" + status
                + ", terminal=" + terminal + "}";
    }
}
