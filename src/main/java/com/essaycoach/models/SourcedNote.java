package com.essaycoach.models;

/**
 * An issue or suggestion tagged with the part of the evaluation that produced it
 * (a dimension tag, or "length").
 */
public record SourcedNote(String source, String text) {

    public static final String LENGTH = "length";

    public static SourcedNote of(Dimension dimension, String text) {
        return new SourcedNote(dimension.tag(), text);
    }

    @Override
    public String toString() {
        return "[" + source + "] " + text;
    }
}
