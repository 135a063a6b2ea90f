package io.a2a.extras.taskengine.handler;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.MessageSendConfiguration;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageSendParams(Message message, MessageSendConfiguration configuration) {
}
