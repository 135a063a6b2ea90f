package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    USER("user"),
    AGENT("agent"),
    SYSTEM("system");

    private final String role;

    Role(String role) {
        this.role = role;
    }

    @JsonValue
    public String asString() {
        return role;
    }

    @JsonCreator
    public static Role fromString(String role) {
        for (Role value : values()) {
            if (value.role.equalsIgnoreCase(role)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Invalid Role: " + role);
    }
}
