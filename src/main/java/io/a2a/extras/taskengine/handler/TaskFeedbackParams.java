package io.a2a.extras.taskengine.handler;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskFeedbackParams(UUID taskId, Integer rating, String comment, Map<String, Object> metadata) {
}
