package tickwork.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import tickwork.engine.model.ExecutionResult;
import tickwork.engine.util.Json;

import java.time.Instant;

/**
 * One execution attempt.
 * Used in GET /api/v1/jobs/{jobId}/results.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResultResponse(
        @JsonProperty("id") String id,
        @JsonProperty("messageId") String messageId,
        @JsonProperty("taskType") String taskType,
        @JsonProperty("queue") String queue,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("status") String status,
        @JsonProperty("terminal") boolean terminal,
        @JsonProperty("output") JsonNode output,
        @JsonProperty("error") String error,
        @JsonProperty("runtimeMs") Long runtimeMs,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("workerId") String workerId) {

    public static ExecutionResultResponse from(ExecutionResult result) {
        JsonNode output = null;
        if (result.output() != null) {
            try {
                output = Json.parse(result.output());
            } catch (IllegalArgumentException e) {
                output = Json.MAPPER.getNodeFactory().textNode(result.output());
            }
        }
        return new ExecutionResultResponse(
                result.id(),
                result.messageId(),
                result.taskType(),
                result.queue(),
                result.attempt(),
                result.status().name(),
                result.terminal(),
                output,
                result.error(),
                result.runtimeMs(),
                result.startedAt(),
                result.finishedAt(),
                result.workerId());
    }
}
