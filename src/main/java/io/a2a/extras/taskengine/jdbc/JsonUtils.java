package io.a2a.extras.taskengine.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import io.a2a.extras.taskengine.storage.TaskSerializationException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON codec for the document columns (history, artifacts, metadata, context data, webhook configs).
 */
public final class JsonUtils {

    public static final TypeReference<List<Message>> MESSAGE_LIST_TYPE = new TypeReference<>() {};
    public static final TypeReference<List<Artifact>> ARTIFACT_LIST_TYPE = new TypeReference<>() {};
    public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    public static final TypeReference<PushNotificationConfig> WEBHOOK_CONFIG_TYPE = new TypeReference<>() {};

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);

    private JsonUtils() {
    }

    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TaskSerializationException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> Optional<T> fromJson(String json, TypeReference<T> typeRef) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(parseJson(json, typeRef));
        } catch (JsonProcessingException e) {
            throw new TaskSerializationException("Failed to deserialize " + typeRef.getType().getTypeName(), e);
        }
    }

    // Some drivers hand back a JSON document wrapped in a JSON string literal.
    private static <T> T parseJson(String json, TypeReference<T> typeRef) throws JsonProcessingException {
        try {
            return OBJECT_MAPPER.readValue(json, typeRef);
        } catch (JsonProcessingException firstException) {
            Optional<String> unwrapped = tryUnwrapJsonString(json);
            if (unwrapped.isEmpty()) {
                throw firstException;
            }
            return OBJECT_MAPPER.readValue(unwrapped.get(), typeRef);
        }
    }

    private static Optional<String> tryUnwrapJsonString(String json) {
        if (!json.startsWith("\"")) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(OBJECT_MAPPER.readValue(json, String.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
