package com.essaycoach.evaluation;

import com.essaycoach.models.DimensionScore;
import com.essaycoach.models.RubricWeights;

import java.util.Collection;

/**
 * Weighted composite of dimension scores on a 0-100 scale.
 *
 * <p>Each available dimension contributes {@code score / ceiling * weight}; the sum is divided by
 * the total weight of the available dimensions, so an unavailable dimension neither counts as
 * zero nor changes the relative weight of the others.
 */
public final class ScoreCalculator {

    private ScoreCalculator() {
    }

    /**
     * @return overall score rounded to one decimal, 0 when no dimension carries weight
     */
    public static double overall(Collection<DimensionScore> scores, RubricWeights weights) {
        double weighted = 0.0;
        double availableWeight = 0.0;
        for (DimensionScore score : scores) {
            if (!score.isAvailable()) {
                continue;
            }
            double weight = weights.weightFor(score.dimension());
            weighted += score.getRatio() * weight;
            availableWeight += weight;
        }
        if (availableWeight <= 0) {
            return 0.0;
        }
        return roundToTenth(weighted / availableWeight * 100);
    }

    public static double roundToTenth(double value) {
        return Math.round(value * 10) / 10.0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
