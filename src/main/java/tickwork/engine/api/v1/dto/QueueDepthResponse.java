package tickwork.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tickwork.engine.broker.QueueStats;

public record QueueDepthResponse(
        @JsonProperty("queue") String queue,
        @JsonProperty("ready") int ready,
        @JsonProperty("inFlight") int inFlight,
        @JsonProperty("delayed") int delayed) {

    public static QueueDepthResponse from(QueueStats stats) {
        return new QueueDepthResponse(stats.queue(), stats.ready(), stats.inFlight(), stats.delayed());
    }
}
