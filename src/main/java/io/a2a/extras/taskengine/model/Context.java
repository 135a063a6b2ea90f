package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A conversation grouping tasks. {@code contextData} belongs to the application.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Context(
        UUID id,
        Map<String, Object> contextData,
        List<Message> messageHistory,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public Context {
        Objects.requireNonNull(id, "id must not be null");
        contextData = contextData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(contextData));
        messageHistory = messageHistory == null ? List.of() : List.copyOf(messageHistory);
    }

    public static Context of(UUID id, Map<String, Object> contextData) {
        return new Context(id, contextData, List.of(), null, null);
    }

    public Context appending(List<Message> messages, OffsetDateTime now) {
        List<Message> history = new ArrayList<>(messageHistory);
        history.addAll(messages);
        return new Context(id, contextData, history, createdAt != null ? createdAt : now, now);
    }
}
