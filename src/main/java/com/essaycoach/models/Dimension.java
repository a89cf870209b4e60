package com.essaycoach.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Rubric axis an essay is scored on, with its point ceiling
 */
public enum Dimension {
    GRAMMAR(30),
    VOCABULARY(30),
    CONTENT(40);

    private final int ceiling;

    Dimension(int ceiling) {
        this.ceiling = ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }

    /**
     * Lower-case tag used in feedback sources and JSON.
     */
    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
