package com.essaycoach.evaluation;

import com.essaycoach.models.Dimension;
import com.essaycoach.models.DimensionScore;
import com.essaycoach.models.GrammarIssue;
import com.essaycoach.models.GradingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Summarises a history of results supplied by the caller. Nothing is stored between calls.
 */
public class LearningProgressAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(LearningProgressAnalyzer.class);

    public static final int MAX_COMMON_ERRORS = 5;

    /**
     * @param history results in the order the essays were written
     */
    public LearningProgress analyze(List<GradingResult> history) {
        if (history == null || history.isEmpty()) {
            return LearningProgress.empty();
        }

        double total = 0.0;
        for (GradingResult result : history) {
            total += result.getOverallScore();
        }
        double average = ScoreCalculator.roundToTenth(total / history.size());
        double improvement = ScoreCalculator.roundToTenth(
                history.get(history.size() - 1).getOverallScore() - history.get(0).getOverallScore());

        LearningProgress progress = new LearningProgress(history.size(), average, improvement,
                weakestDimension(history), commonErrors(history));
        logger.info("📈 Progress over {} essay(s): average {}, improvement {}",
                progress.totalEssays(), progress.averageScore(), progress.improvement());
        return progress;
    }

    private static Dimension weakestDimension(List<GradingResult> history) {
        Dimension weakest = null;
        double lowest = Double.MAX_VALUE;
        for (Dimension dimension : Dimension.values()) {
            double sum = 0.0;
            int counted = 0;
            for (GradingResult result : history) {
                DimensionScore score = result.getScore(dimension);
                if (score != null && score.isAvailable()) {
                    sum += score.getRatio();
                    counted++;
                }
            }
            if (counted > 0 && sum / counted < lowest) {
                lowest = sum / counted;
                weakest = dimension;
            }
        }
        return weakest;
    }

    private static List<String> commonErrors(List<GradingResult> history) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GradingResult result : history) {
            for (GrammarIssue issue : result.getGrammarErrors()) {
                counts.merge(issue.description(), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(MAX_COMMON_ERRORS)
                .map(Map.Entry::getKey)
                .toList();
    }
}
