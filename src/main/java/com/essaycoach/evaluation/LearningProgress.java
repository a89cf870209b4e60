package com.essaycoach.evaluation;

import com.essaycoach.models.Dimension;

import java.util.List;
import java.util.Optional;

/**
 * Summary of a learner's graded essays, oldest first
 *
 * @param improvement      overall score of the latest essay minus that of the first
 * @param weakestDimension dimension with the lowest average share of its ceiling, null without scores
 * @param commonErrors     most frequent pattern findings, most frequent first
 */
public record LearningProgress(
        int totalEssays,
        double averageScore,
        double improvement,
        Dimension weakestDimension,
        List<String> commonErrors
) {

    public LearningProgress {
        commonErrors = commonErrors == null ? List.of() : List.copyOf(commonErrors);
    }

    public static LearningProgress empty() {
        return new LearningProgress(0, 0.0, 0.0, null, List.of());
    }

    public Optional<Dimension> weakest() {
        return Optional.ofNullable(weakestDimension);
    }
}
