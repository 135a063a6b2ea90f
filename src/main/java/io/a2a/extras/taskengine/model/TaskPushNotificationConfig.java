package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskPushNotificationConfig(UUID taskId, PushNotificationConfig pushNotificationConfig) {
}
