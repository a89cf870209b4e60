package com.essaycoach.judgment;

import com.essaycoach.models.Dimension;

import java.util.List;

/**
 * What the judgment model said about one dimension of an essay
 */
public record Judgment(double score, String feedback, List<String> issues, List<String> suggestions) {

    public Judgment {
        feedback = feedback == null ? "" : feedback;
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * True when the score is a finite number in {@code [0, ceiling]} for the dimension.
     */
    public boolean isWithinCeiling(Dimension dimension) {
        return Double.isFinite(score) && score >= 0 && score <= dimension.getCeiling();
    }
}
