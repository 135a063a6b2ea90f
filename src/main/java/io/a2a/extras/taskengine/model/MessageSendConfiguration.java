package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Options of a {@code message/send} request: a subscriber registered for the resulting task
 * and the number of history messages returned.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageSendConfiguration(PushNotificationConfig pushNotificationConfig, Integer historyLength) {

    public static final MessageSendConfiguration DEFAULT = new MessageSendConfiguration(null, null);
}
