package tickwork.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tickwork.engine.model.DeadLetter;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeadLetterResponse(
        @JsonProperty("messageId") String messageId,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("taskType") String taskType,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("error") String error,
        @JsonProperty("enqueuedAt") Instant enqueuedAt,
        @JsonProperty("deadLetteredAt") Instant deadLetteredAt) {

    public static DeadLetterResponse from(DeadLetter letter) {
        return new DeadLetterResponse(letter.messageId(), letter.jobId(), letter.taskType(), letter.attempts(),
                letter.error(), letter.enqueuedAt(), letter.deadLetteredAt());
    }
}
