package io.a2a.extras.taskengine.model;

public record TextPart(String text) implements Part {

    public static final String KIND = "text";
}
