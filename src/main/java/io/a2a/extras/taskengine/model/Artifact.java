package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Artifact(
        UUID artifactId,
        String name,
        String description,
        List<Part> parts,
        Map<String, Object> metadata
) {

    public Artifact {
        parts = parts == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parts));
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Artifact of(String name, Part... parts) {
        return new Artifact(UUID.randomUUID(), name, null, List.of(parts), null);
    }
}
