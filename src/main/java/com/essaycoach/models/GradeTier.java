package com.essaycoach.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * School level a prompt is written for. Declaration order is the ordering of the tiers.
 */
public enum GradeTier {
    PRIMARY_SCHOOL("primary_school", "小学", 30, 100),
    MIDDLE_SCHOOL("middle_school", "初中", 80, 180),
    HIGH_SCHOOL("high_school", "高中", 150, 300);

    private final String value;
    private final String localName;
    private final int minWords;
    private final int maxWords;

    GradeTier(String value, String localName, int minWords, int maxWords) {
        this.value = value;
        this.localName = localName;
        this.minWords = minWords;
        this.maxWords = maxWords;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLocalName() {
        return localName;
    }

    public int getMinWords() {
        return minWords;
    }

    public int getMaxWords() {
        return maxWords;
    }

    /**
     * Resolve a tier from its canonical value or a known alias.
     * Accepts "primary", "middle_school_2", "高中" and the like.
     *
     * @throws IllegalArgumentException if the value names no tier
     */
    @JsonCreator
    public static GradeTier fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Grade tier is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (GradeTier tier : values()) {
            if (normalized.equals(tier.value) || normalized.equals(tier.name().toLowerCase(Locale.ROOT))) {
                return tier;
            }
            // "primary" or "primary_school_5"
            String shortName = tier.value.substring(0, tier.value.indexOf('_'));
            if (normalized.equals(shortName) || normalized.startsWith(tier.value + "_")) {
                return tier;
            }
            if (raw.trim().startsWith(tier.localName)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown grade tier: " + raw);
    }
}
