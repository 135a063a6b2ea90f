package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskFeedback(UUID id, UUID taskId, Map<String, Object> feedbackData, OffsetDateTime createdAt) {

    public static final String RATING = "rating";
    public static final String COMMENT = "comment";
    public static final String METADATA = "metadata";

    public TaskFeedback {
        feedbackData = feedbackData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(feedbackData));
    }

    public Integer rating() {
        return feedbackData.get(RATING) instanceof Number number ? number.intValue() : null;
    }

    public String comment() {
        return feedbackData.get(COMMENT) instanceof String comment ? comment : null;
    }
}
