package com.essaycoach.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Score along one rubric axis. {@code score} is null when the dimension could not be scored.
 */
public record DimensionScore(
        Dimension dimension,
        Double score,
        int ceiling,
        Status status,
        String feedback,
        List<String> issues,
        List<String> suggestions
) {

    /**
     * How the score was obtained
     */
    public enum Status {
        /** judgment model plus deterministic signals */
        JUDGED,
        /** judgment model failed, deterministic fallback used */
        DEGRADED,
        /** no score could be produced */
        UNAVAILABLE
    }

    public DimensionScore {
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        feedback = feedback == null ? "" : feedback;
    }

    public static DimensionScore unavailable(Dimension dimension, String reason) {
        return new DimensionScore(dimension, null, dimension.getCeiling(), Status.UNAVAILABLE,
                reason, List.of(), List.of());
    }

    @JsonIgnore
    public boolean isAvailable() {
        return score != null;
    }

    /**
     * Fraction of the ceiling achieved, 0 when unavailable.
     */
    @JsonIgnore
    public double getRatio() {
        if (score == null || ceiling == 0) return 0.0;
        return score / ceiling;
    }

    @Override
    public String toString() {
        if (score == null) {
            return String.format("%s: unavailable", dimension.tag());
        }
        return String.format("%s: %.1f/%d (%s)", dimension.tag(), score, ceiling, status);
    }
}
