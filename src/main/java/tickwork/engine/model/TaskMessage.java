package tickwork.engine.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable unit of dispatch held in a broker queue.
 * {@code attempts} counts deliveries: it is incremented by the broker each time
 * the message is handed to a worker.
 */
public final class TaskMessage {
    private final String id;
    private final String queue;
    private final String jobId; // null for ad-hoc dispatch
    private final String taskType;
    private final String params;
    private final Instant enqueuedAt;
    private final Instant visibleAt;
    private final int attempts;
    private final int maxAttempts;
    private final String receipt; // delivery handle, set on dequeue
    private final String lastError;

    private TaskMessage(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.queue = Objects.requireNonNull(builder.queue, "queue is required");
        this.jobId = builder.jobId;
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.params = builder.params != null ? builder.params : "{}";
        this.enqueuedAt = builder.enqueuedAt;
        this.visibleAt = builder.visibleAt;
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.receipt = builder.receipt;
        this.lastError = builder.lastError;
    }

    public String id() {
        return id;
    }

    public String queue() {
        return queue;
    }

    public String jobId() {
        return jobId;
    }

    public String taskType() {
        return taskType;
    }

    public String params() {
        return params;
    }

    public Instant enqueuedAt() {
        return enqueuedAt;
    }

    public Instant visibleAt() {
        return visibleAt;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String receipt() {
        return receipt;
    }

    public String lastError() {
        return lastError;
    }

    /** True if the current delivery is not the last one allowed. */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public boolean isScheduled() {
        return jobId != null;
    }

    public static String newId() {
        return "msg-" + UUID.randomUUID();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .queue(queue)
                .jobId(jobId)
                .taskType(taskType)
                .params(params)
                .enqueuedAt(enqueuedAt)
                .visibleAt(visibleAt)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .receipt(receipt)
                .lastError(lastError);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String queue;
        private String jobId;
        private String taskType;
        private String params;
        private Instant enqueuedAt;
        private Instant visibleAt;
        private int attempts = 0;
        private int maxAttempts = 3;
        private String receipt;
        private String lastError;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
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

        public Builder params(String params) {
            this.params = params;
            return this;
        }

        public Builder enqueuedAt(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }

        public Builder visibleAt(Instant visibleAt) {
            this.visibleAt = visibleAt;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder receipt(String receipt) {
            this.receipt = receipt;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public TaskMessage build() {
            return new TaskMessage(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskMessage that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskMessage{id='" + id + "', queue='" + queue + "', taskType='" + taskType
                + "', jobId='" + jobId + "', attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
