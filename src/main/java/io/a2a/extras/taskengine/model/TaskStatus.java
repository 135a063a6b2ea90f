package io.a2a.extras.taskengine.model;

import java.time.OffsetDateTime;
import java.util.Objects;

public record TaskStatus(TaskState state, OffsetDateTime timestamp) {

    public TaskStatus {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
