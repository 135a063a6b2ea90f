package io.a2a.extras.taskengine.push;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.a2a.extras.taskengine.model.Artifact;

import java.time.OffsetDateTime;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"event_id", "sequence", "timestamp", "kind", "task_id", "context_id", "artifact"})
public record ArtifactUpdateEvent(
        UUID eventId,
        long sequence,
        OffsetDateTime timestamp,
        UUID taskId,
        UUID contextId,
        Artifact artifact
) implements LifecycleEvent {

    public static final String KIND = "artifact-update";

    @Override
    @JsonProperty("kind")
    public String kind() {
        return KIND;
    }
}
