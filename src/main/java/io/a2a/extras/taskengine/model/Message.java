package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Message(
        UUID messageId,
        Role role,
        List<Part> parts,
        UUID taskId,
        UUID contextId,
        List<UUID> referenceTaskIds,
        Map<String, Object> metadata,
        OffsetDateTime timestamp
) {

    public Message {
        parts = parts == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parts));
        referenceTaskIds = referenceTaskIds == null ? null : List.copyOf(referenceTaskIds);
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns a copy addressed to the given task and context, stamped with {@code now}
     * when the sender did not supply a timestamp and with a fresh id when none was given.
     */
    public Message addressedTo(UUID taskId, UUID contextId, OffsetDateTime now) {
        return new Builder(this)
                .messageId(messageId != null ? messageId : UUID.randomUUID())
                .taskId(taskId)
                .contextId(contextId)
                .timestamp(timestamp != null ? timestamp : now)
                .build();
    }

    public Message withReferenceTaskId(UUID referenceTaskId) {
        List<UUID> references = new ArrayList<>(referenceTaskIds == null ? List.of() : referenceTaskIds);
        if (!references.contains(referenceTaskId)) {
            references.add(referenceTaskId);
        }
        return new Builder(this).referenceTaskIds(references).build();
    }

    public static class Builder {
        private UUID messageId;
        private Role role;
        private List<Part> parts;
        private UUID taskId;
        private UUID contextId;
        private List<UUID> referenceTaskIds;
        private Map<String, Object> metadata;
        private OffsetDateTime timestamp;

        public Builder() {
        }

        public Builder(Message message) {
            this.messageId = message.messageId;
            this.role = message.role;
            this.parts = message.parts;
            this.taskId = message.taskId;
            this.contextId = message.contextId;
            this.referenceTaskIds = message.referenceTaskIds;
            this.metadata = message.metadata;
            this.timestamp = message.timestamp;
        }

        public Builder messageId(UUID messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        public Builder parts(List<Part> parts) {
            this.parts = parts;
            return this;
        }

        public Builder parts(Part... parts) {
            this.parts = List.of(parts);
            return this;
        }

        public Builder taskId(UUID taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder contextId(UUID contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder referenceTaskIds(List<UUID> referenceTaskIds) {
            this.referenceTaskIds = referenceTaskIds;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder timestamp(OffsetDateTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Message build() {
            return new Message(messageId, role, parts, taskId, contextId, referenceTaskIds, metadata, timestamp);
        }
    }
}
