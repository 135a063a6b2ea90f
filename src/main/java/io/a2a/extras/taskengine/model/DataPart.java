package io.a2a.extras.taskengine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DataPart(Map<String, Object> data) implements Part {

    public static final String KIND = "data";

    public DataPart {
        data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
