package com.essaycoach.evaluation;

import com.essaycoach.errors.EssayCoachException;
import com.essaycoach.errors.InvalidSubmissionException;
import com.essaycoach.errors.JudgmentUnavailableException;
import com.essaycoach.judgment.Judgment;
import com.essaycoach.judgment.JudgmentClient;
import com.essaycoach.models.*;
import com.essaycoach.utils.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Scores one essay against a prompt.
 *
 * <p>Every call runs the same fixed sequence: text metrics, then grammar, vocabulary and content,
 * then aggregation. The three judgment calls are issued concurrently, each bounded by the
 * configured timeout, and aggregation waits for all of them. A failed or timed-out judgment
 * degrades its dimension instead of failing the evaluation. The pipeline keeps no state
 * between calls.
 */
public class EvaluationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationPipeline.class);

    static final double LOW_DIVERSITY = 0.3;
    static final double HIGH_DIVERSITY = 0.6;
    static final double REPETITIVE_DIVERSITY = 0.4;
    static final double VARIED_DIVERSITY = 0.7;
    static final double BASIC_VOCABULARY_RATIO = 0.1;
    static final double RICH_VOCABULARY_RATIO = 0.3;

    private final JudgmentClient judgmentClient;
    private final PipelineSettings settings;
    private final ExecutorService executor;

    /**
     * @param executor runs the blocking judgment calls; a timed-out call is interrupted so its
     *                 thread goes back to the pool
     */
    public EvaluationPipeline(JudgmentClient judgmentClient, PipelineSettings settings, ExecutorService executor) {
        this.judgmentClient = Objects.requireNonNull(judgmentClient, "judgmentClient");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Blocking form of {@link #evaluateAsync}.
     *
     * @throws InvalidSubmissionException if the essay is blank or the prompt is absent
     */
    public GradingResult evaluate(String essay, PromptRecord prompt, RubricWeights weights) {
        try {
            return evaluateAsync(essay, prompt, weights).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EssayCoachException("Evaluation failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Start an evaluation. Input is validated before anything is scheduled.
     * Cancelling the returned future abandons the outstanding judgment calls.
     *
     * @throws InvalidSubmissionException if the essay is blank or the prompt is absent
     */
    public CompletableFuture<GradingResult> evaluateAsync(String essay, PromptRecord prompt, RubricWeights weights) {
        if (essay == null || essay.isBlank()) {
            throw new InvalidSubmissionException("Essay text is empty");
        }
        if (prompt == null) {
            throw new InvalidSubmissionException("No prompt supplied for the essay");
        }
        Objects.requireNonNull(weights, "weights");

        EssayMetrics metrics = EssayMetrics.of(essay);
        logger.debug("Metrics for prompt {}: {} words, {} sentences, diversity {}, {} pattern finding(s)",
                prompt.getId(), metrics.wordCount, metrics.sentenceCount,
                String.format("%.3f", metrics.diversity), metrics.patternIssueCount);

        CompletableFuture<Attempt> grammar = judgeAsync(Dimension.GRAMMAR, essay, prompt);
        CompletableFuture<Attempt> vocabulary = judgeAsync(Dimension.VOCABULARY, essay, prompt);
        CompletableFuture<Attempt> content = judgeAsync(Dimension.CONTENT, essay, prompt);

        CompletableFuture<GradingResult> result = CompletableFuture.allOf(grammar, vocabulary, content)
                .thenApply(ignored -> aggregate(prompt, weights, metrics,
                        scoreGrammar(grammar.join(), metrics),
                        scoreVocabulary(vocabulary.join(), metrics),
                        scoreContent(content.join())));

        result.whenComplete((graded, error) -> {
            if (result.isCancelled()) {
                logger.info("🛑 Evaluation for prompt {} cancelled, abandoning judgment calls", prompt.getId());
                grammar.cancel(true);
                vocabulary.cancel(true);
                content.cancel(true);
            }
        });
        return result;
    }

    private CompletableFuture<Attempt> judgeAsync(Dimension dimension, String essay, PromptRecord prompt) {
        String guidance = guidanceFor(dimension, prompt);
        long timeoutMillis = settings.judgmentTimeout().toMillis();
        CompletableFuture<Judgment> call = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            // the deadline counts from when a worker picks the call up, not from submission
            call.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
            try {
                call.complete(judgmentClient.judge(dimension, essay, prompt, guidance));
            } catch (JudgmentUnavailableException | RuntimeException e) {
                call.completeExceptionally(e);
            }
        });
        call.whenComplete((judgment, error) -> {
            if (error instanceof TimeoutException || error instanceof CancellationException) {
                task.cancel(true);
            }
        });

        CompletableFuture<Attempt> attempt = call.handle((judgment, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                String reason = cause instanceof TimeoutException
                        ? "timed out after " + timeoutMillis + " ms"
                        : String.valueOf(cause.getMessage());
                logger.warn("⚠️ {} judgment unavailable: {}", dimension.tag(), reason);
                return Attempt.failed(reason);
            }
            if (judgment == null || !judgment.isWithinCeiling(dimension)) {
                logger.warn("⚠️ {} judgment returned an unusable score: {}", dimension.tag(),
                        judgment == null ? null : judgment.score());
                return Attempt.failed("score outside 0-" + dimension.getCeiling());
            }
            return Attempt.succeeded(judgment);
        });
        attempt.whenComplete((ignored, error) -> {
            if (attempt.isCancelled()) {
                call.cancel(true);
            }
        });
        return attempt;
    }

    /**
     * Rubric text sent to the judge for one dimension
     */
    static String guidanceFor(Dimension dimension, PromptRecord prompt) {
        switch (dimension) {
            case GRAMMAR:
                return "Check tense, voice and subject-verb agreement, whether sentences are complete, "
                        + "and whether punctuation is used correctly.";
            case VOCABULARY:
                return "Check whether words are accurate and appropriate, how rich and varied the vocabulary is, "
                        + "and whether there are spelling mistakes.";
            case CONTENT:
                StringBuilder guidance = new StringBuilder(
                        "Check whether the essay answers the task, whether the content is full and logical, "
                        + "and whether it has a clear beginning, body and ending.");
                if (!prompt.getRequirements().isEmpty()) {
                    guidance.append(" The essay must meet these requirements: ")
                            .append(String.join("; ", prompt.getRequirements())).append('.');
                }
                if (!prompt.getKeywords().isEmpty()) {
                    guidance.append(" Relevant keywords: ").append(String.join(", ", prompt.getKeywords())).append('.');
                }
                return guidance.toString();
            default:
                throw new IllegalArgumentException("Unknown dimension: " + dimension);
        }
    }

    DimensionScore scoreGrammar(Attempt attempt, EssayMetrics metrics) {
        Dimension dimension = Dimension.GRAMMAR;
        int ceiling = dimension.getCeiling();
        int issueCount = metrics.patternIssueCount;
        List<String> issues = new ArrayList<>();
        for (GrammarIssue issue : metrics.patternIssues) {
            issues.add(issue.description());
        }

        if (attempt.judgment == null) {
            double score = ceiling - Math.min(ceiling, issueCount * settings.penaltyPerIssue());
            String feedback = String.format("Estimated from %d pattern finding(s); the grammar judge was unavailable (%s).",
                    issueCount, attempt.failure);
            List<String> suggestions = issueCount > 0
                    ? List.of("Review the flagged sentences for agreement, articles and capitalisation.")
                    : List.of();
            return new DimensionScore(dimension, score, ceiling, DimensionScore.Status.DEGRADED,
                    feedback, issues, suggestions);
        }

        Judgment judgment = attempt.judgment;
        double penalty = 0;
        if (issueCount > 10) {
            penalty = 8;
        } else if (issueCount > 5) {
            penalty = 5;
        } else if (issueCount > 2) {
            penalty = 3;
        }
        double score = ScoreCalculator.roundToTenth(Math.max(0, judgment.score() - penalty));
        issues.addAll(judgment.issues());
        return new DimensionScore(dimension, score, ceiling, DimensionScore.Status.JUDGED,
                judgment.feedback(), issues, judgment.suggestions());
    }

    DimensionScore scoreVocabulary(Attempt attempt, EssayMetrics metrics) {
        Dimension dimension = Dimension.VOCABULARY;
        int ceiling = dimension.getCeiling();
        double diversity = metrics.diversity;

        List<String> observations = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        if (diversity < REPETITIVE_DIVERSITY) {
            suggestions.add("Many words are repeated; try using a wider range of words.");
        } else if (diversity > VARIED_DIVERSITY) {
            observations.add("Word variety is good.");
        }
        if (metrics.advancedRatio < BASIC_VOCABULARY_RATIO) {
            suggestions.add("Try using more advanced vocabulary.");
        } else if (metrics.advancedRatio > RICH_VOCABULARY_RATIO) {
            observations.add("Advanced vocabulary is used well.");
        }

        if (attempt.judgment == null) {
            double score = ScoreCalculator.roundToTenth(ceiling * ScoreCalculator.clamp(diversity, 0, 1));
            String feedback = String.format("Estimated from lexical diversity %.2f; the vocabulary judge was unavailable (%s).",
                    diversity, attempt.failure);
            return new DimensionScore(dimension, score, ceiling, DimensionScore.Status.DEGRADED,
                    joinFeedback(feedback, observations), List.of(), suggestions);
        }

        Judgment judgment = attempt.judgment;
        double adjusted = judgment.score();
        if (diversity < LOW_DIVERSITY) {
            adjusted -= 5;
        } else if (diversity > HIGH_DIVERSITY) {
            adjusted += 3;
        }
        double score = ScoreCalculator.roundToTenth(ScoreCalculator.clamp(adjusted, 0, ceiling));
        List<String> allSuggestions = new ArrayList<>(judgment.suggestions());
        allSuggestions.addAll(suggestions);
        return new DimensionScore(dimension, score, ceiling, DimensionScore.Status.JUDGED,
                joinFeedback(judgment.feedback(), observations), judgment.issues(), allSuggestions);
    }

    DimensionScore scoreContent(Attempt attempt) {
        if (attempt.judgment == null) {
            return DimensionScore.unavailable(Dimension.CONTENT,
                    "Content could not be judged (" + attempt.failure + ").");
        }
        Judgment judgment = attempt.judgment;
        return new DimensionScore(Dimension.CONTENT, ScoreCalculator.roundToTenth(judgment.score()),
                Dimension.CONTENT.getCeiling(), DimensionScore.Status.JUDGED,
                judgment.feedback(), judgment.issues(), judgment.suggestions());
    }

    private GradingResult aggregate(PromptRecord prompt, RubricWeights weights, EssayMetrics metrics,
                                    DimensionScore grammar, DimensionScore vocabulary, DimensionScore content) {
        List<DimensionScore> scores = List.of(grammar, vocabulary, content);
        double overall = ScoreCalculator.overall(scores, weights);

        Set<Dimension> degraded = EnumSet.noneOf(Dimension.class);
        Set<Dimension> unavailable = EnumSet.noneOf(Dimension.class);
        List<SourcedNote> issues = new ArrayList<>();
        List<SourcedNote> suggestions = new ArrayList<>();
        for (DimensionScore score : scores) {
            if (score.status() == DimensionScore.Status.DEGRADED) {
                degraded.add(score.dimension());
            } else if (score.status() == DimensionScore.Status.UNAVAILABLE) {
                unavailable.add(score.dimension());
            }
            for (String issue : score.issues()) {
                issues.add(SourcedNote.of(score.dimension(), issue));
            }
            for (String suggestion : score.suggestions()) {
                suggestions.add(SourcedNote.of(score.dimension(), suggestion));
            }
        }

        boolean lengthCompliant = weights.acceptsWordCount(metrics.wordCount);
        if (!lengthCompliant) {
            String advice = metrics.wordCount < weights.minWords()
                    ? String.format("The essay has %d words; write at least %d.", metrics.wordCount, weights.minWords())
                    : String.format("The essay has %d words; keep it to at most %d.", metrics.wordCount, weights.maxWords());
            suggestions.add(new SourcedNote(SourcedNote.LENGTH, advice));
        }

        GradingResult result = new GradingResult(
                overall,
                GradingResult.calculateLetterGrade(overall),
                grammar,
                vocabulary,
                content,
                metrics.patternIssues,
                issues,
                suggestions,
                composeFeedback(overall, scores, lengthCompliant),
                metrics.wordCount,
                metrics.sentenceCount,
                metrics.diversity,
                lengthCompliant,
                degraded,
                unavailable);
        logger.info("📝 Graded essay for prompt {}: {} ({}){}", prompt.getId(),
                String.format("%.1f", overall), result.getGrade(), result.isDegraded() ? " [degraded]" : "");
        return result;
    }

    static String composeFeedback(double overall, List<DimensionScore> scores, boolean lengthCompliant) {
        StringBuilder feedback = new StringBuilder();
        if (overall >= 90) {
            feedback.append("Excellent work.");
        } else if (overall >= 80) {
            feedback.append("Good work with a few points to polish.");
        } else if (overall >= 70) {
            feedback.append("A fair essay with clear room to improve.");
        } else if (overall >= 60) {
            feedback.append("The essay meets basic expectations but needs more work.");
        } else {
            feedback.append("The essay needs substantial revision.");
        }
        for (DimensionScore score : scores) {
            if (score.isAvailable() && !score.feedback().isBlank()) {
                feedback.append(' ').append(capitalize(score.dimension().tag())).append(": ")
                        .append(score.feedback().trim());
            }
        }
        List<String> missing = scores.stream()
                .filter(score -> !score.isAvailable())
                .map(score -> score.dimension().tag())
                .toList();
        if (!missing.isEmpty()) {
            feedback.append(" Not scored: ").append(String.join(", ", missing))
                    .append("; the overall score uses the remaining dimensions.");
        }
        if (!lengthCompliant) {
            feedback.append(" The essay length is outside the expected range.");
        }
        return feedback.toString();
    }

    private static String joinFeedback(String feedback, List<String> observations) {
        if (observations.isEmpty()) {
            return feedback;
        }
        String extra = String.join(" ", observations);
        return feedback == null || feedback.isBlank() ? extra : feedback.trim() + " " + extra;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    /**
     * Deterministic measurements taken once per essay
     */
    static final class EssayMetrics {
        final int wordCount;
        final int sentenceCount;
        final double diversity;
        final double advancedRatio;
        final List<GrammarIssue> patternIssues;
        final int patternIssueCount;

        private EssayMetrics(int wordCount, int sentenceCount, double diversity, double advancedRatio,
                             TextMetrics.PatternScan scan) {
            this.wordCount = wordCount;
            this.sentenceCount = sentenceCount;
            this.diversity = diversity;
            this.advancedRatio = advancedRatio;
            this.patternIssues = scan.findings();
            this.patternIssueCount = scan.total();
        }

        static EssayMetrics of(String essay) {
            return new EssayMetrics(
                    TextMetrics.wordCount(essay),
                    TextMetrics.sentenceCount(essay),
                    TextMetrics.lexicalDiversity(essay),
                    TextMetrics.advancedWordRatio(essay),
                    TextMetrics.scanPatterns(essay));
        }
    }

    /**
     * A judgment, or the reason there is none
     */
    static final class Attempt {
        final Judgment judgment;
        final String failure;

        private Attempt(Judgment judgment, String failure) {
            this.judgment = judgment;
            this.failure = failure;
        }

        static Attempt succeeded(Judgment judgment) {
            return new Attempt(judgment, null);
        }

        static Attempt failed(String reason) {
            return new Attempt(null, reason);
        }
    }
}
