package com.essaycoach.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * English proficiency of the learner
 */
public enum ProficiencyLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    private static final Map<String, ProficiencyLevel> ALIASES = Map.of(
        "初级", BEGINNER,
        "基础", BEGINNER,
        "中级", INTERMEDIATE,
        "中等", INTERMEDIATE,
        "高级", ADVANCED,
        "进阶", ADVANCED
    );

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if the value names no level
     */
    @JsonCreator
    public static ProficiencyLevel fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Proficiency level is required");
        }
        String trimmed = raw.trim();
        ProficiencyLevel alias = ALIASES.get(trimmed);
        if (alias != null) {
            return alias;
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown proficiency level: " + raw, e);
        }
    }
}
