package io.a2a.extras.taskengine.handler;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

/**
 * Both fields optional: without {@code context_id} every task is listed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskListParams(UUID contextId, Integer length) {
}
