package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TaskState {
    SUBMITTED("submitted", false),
    WORKING("working", false),
    INPUT_REQUIRED("input-required", false),
    AUTH_REQUIRED("auth-required", false),
    COMPLETED("completed", true),
    FAILED("failed", true),
    CANCELED("canceled", true);

    private final String state;
    private final boolean isFinal;

    TaskState(String state, boolean isFinal) {
        this.state = state;
        this.isFinal = isFinal;
    }

    @JsonValue
    public String asString() {
        return state;
    }

    public boolean isFinal() {
        return isFinal;
    }

    /**
     * Whether the task is paused waiting for the client, so the next message in the
     * context continues it instead of starting a new task.
     */
    public boolean isInterrupted() {
        return this == INPUT_REQUIRED || this == AUTH_REQUIRED;
    }

    @JsonCreator
    public static TaskState fromString(String state) {
        return Arrays.stream(values())
                .filter(value -> value.state.equalsIgnoreCase(state) || value.name().equalsIgnoreCase(state))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid TaskState: " + state));
    }
}
