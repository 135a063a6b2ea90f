package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of agent work. History and artifacts only ever grow, and nothing changes once
 * the status reaches a final state.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Task(
        UUID id,
        UUID contextId,
        String kind,
        TaskStatus status,
        List<Message> history,
        List<Artifact> artifacts,
        Map<String, Object> metadata,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static final String KIND = "task";

    public Task {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(contextId, "contextId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        kind = kind == null ? KIND : kind;
        history = history == null ? List.of() : List.copyOf(history);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @JsonIgnore
    public TaskState state() {
        return status.state();
    }

    /**
     * Copy holding only the most recent {@code historyLength} messages; {@code null}
     * keeps the full history.
     */
    public Task withHistoryLength(Integer historyLength) {
        if (historyLength == null || historyLength >= history.size()) {
            return this;
        }
        return new Builder(this)
                .history(history.subList(history.size() - historyLength, history.size()))
                .build();
    }

    public static class Builder {
        private UUID id;
        private UUID contextId;
        private String kind = KIND;
        private TaskStatus status;
        private List<Message> history;
        private List<Artifact> artifacts;
        private Map<String, Object> metadata;
        private OffsetDateTime createdAt;
        private OffsetDateTime updatedAt;

        public Builder() {
        }

        public Builder(Task task) {
            this.id = task.id;
            this.contextId = task.contextId;
            this.kind = task.kind;
            this.status = task.status;
            this.history = task.history;
            this.artifacts = task.artifacts;
            this.metadata = task.metadata;
            this.createdAt = task.createdAt;
            this.updatedAt = task.updatedAt;
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder contextId(UUID contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder history(List<Message> history) {
            this.history = history;
            return this;
        }

        public Builder artifacts(List<Artifact> artifacts) {
            this.artifacts = artifacts;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder createdAt(OffsetDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(OffsetDateTime updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(id, contextId, kind, status, history, artifacts, metadata, createdAt, updatedAt);
        }
    }
}
