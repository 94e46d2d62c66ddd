package tickwork.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("store") String store,
        @JsonProperty("broker") String broker,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("enabledJobs") Integer enabledJobs,
        @JsonProperty("deadLetters") Integer deadLetters,
        @JsonProperty("queues") List<QueueDepthResponse> queues,
        @JsonProperty("scheduler") SchedulerStatus scheduler,
        @JsonProperty("worker") WorkerStatus worker) {

    public static HealthResponse healthy(String uptime, String version, int enabledJobs, int deadLetters,
            List<QueueDepthResponse> queues, SchedulerStatus scheduler, WorkerStatus worker) {
        return new HealthResponse("healthy", "ok", "ok", uptime, version, enabledJobs, deadLetters, queues,
                scheduler, worker);
    }

    public static HealthResponse unhealthy(String store, String broker) {
        return new HealthResponse("unhealthy", store, broker, null, null, null, null, null, null, null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SchedulerStatus(
            @JsonProperty("instanceId") String instanceId,
            @JsonProperty("running") boolean running,
            @JsonProperty("leader") boolean leader,
            @JsonProperty("lastTick") String lastTick,
            @JsonProperty("lastEnqueued") Integer lastEnqueued) {
    }

    public record WorkerStatus(
            @JsonProperty("workerId") String workerId,
            @JsonProperty("running") boolean running,
            @JsonProperty("inFlight") int inFlight,
            @JsonProperty("processed") long processed,
            @JsonProperty("failed") long failed) {
    }
}
