package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A piece of message or artifact content, discriminated on the wire by its {@code kind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextPart.class, name = TextPart.KIND),
        @JsonSubTypes.Type(value = DataPart.class, name = DataPart.KIND),
        @JsonSubTypes.Type(value = FilePart.class, name = FilePart.KIND)
})
public sealed interface Part permits TextPart, DataPart, FilePart {
}
