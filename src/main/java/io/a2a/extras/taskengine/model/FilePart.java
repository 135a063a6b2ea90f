package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * File content referenced by {@code uri} or inlined as base64 {@code bytes}; exactly one is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FilePart(String name, String mimeType, String uri, String bytes) implements Part {

    public static final String KIND = "file";

    public static FilePart ofUri(String name, String mimeType, String uri) {
        return new FilePart(name, mimeType, uri, null);
    }

    public static FilePart ofBytes(String name, String mimeType, String base64) {
        return new FilePart(name, mimeType, null, base64);
    }
}
