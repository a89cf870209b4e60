package com.essaycoach.workflow;

import com.essaycoach.errors.InvalidSubmissionException;
import com.essaycoach.evaluation.EvaluationPipeline;
import com.essaycoach.models.*;
import com.essaycoach.retrieval.RetrievalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Entry point for callers: pick a prompt, then grade an essay written for it.
 * Holds no per-request state. Grading never throws; every call returns a {@link GradingOutcome}.
 */
public class WorkflowCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowCoordinator.class);

    /** Used when a prompt carries no requirements of its own */
    public static final List<String> DEFAULT_REQUIREMENTS = List.of(
        "Follow the task as given",
        "Check your grammar and spelling",
        "Keep the content coherent");

    private final RetrievalEngine retrievalEngine;
    private final EvaluationPipeline pipeline;
    private final RubricWeights weights;

    public WorkflowCoordinator(RetrievalEngine retrievalEngine, EvaluationPipeline pipeline, RubricWeights weights) {
        this.retrievalEngine = Objects.requireNonNull(retrievalEngine, "retrievalEngine");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public PromptSelection selectPrompt(EvaluationCriteria criteria) {
        return retrievalEngine.select(criteria);
    }

    public PromptSelection selectPrompt(RetrievalRequest request) {
        return retrievalEngine.select(request);
    }

    /**
     * The selected prompt, or a generic one for the criteria when the corpus has nothing.
     * Prompts without requirements get {@link #DEFAULT_REQUIREMENTS}.
     */
    public PromptRecord selectPromptOrGeneric(EvaluationCriteria criteria) {
        PromptSelection selection = selectPrompt(criteria);
        if (!selection.isMatched()) {
            logger.info("📄 No stored prompt for {}, using a generic prompt", criteria);
            return genericPrompt(criteria);
        }
        PromptRecord prompt = selection.getPrompt().orElseThrow();
        if (!prompt.getRequirements().isEmpty()) {
            return prompt;
        }
        return new PromptRecord(prompt.getId(), prompt.getTitle(), prompt.getPrompt(), prompt.getGrade(),
                prompt.getLevel(), prompt.getGenre(), prompt.getTopic(), DEFAULT_REQUIREMENTS,
                prompt.getKeywords(), prompt.getEmbedding());
    }

    static PromptRecord genericPrompt(EvaluationCriteria criteria) {
        GradeTier grade = criteria.getGrade();
        String genre = criteria.getGenre().orElse("narrative");
        String topic = criteria.getTopic().orElse("free topic");
        String subject = criteria.getTopic().map(t -> "about " + t).orElse("about something that matters to you");
        String task = String.format(Locale.ROOT, "Write a %s essay %s. (%d-%d words)",
                genre, subject, grade.getMinWords(), grade.getMaxWords());
        return new PromptRecord(
                "generic-" + grade.getValue() + "-" + criteria.getLevel().getValue(),
                "Free Writing",
                task,
                grade,
                criteria.getLevel(),
                genre,
                topic,
                DEFAULT_REQUIREMENTS,
                List.of());
    }

    public List<PromptRecord> recommendPrompts(EvaluationCriteria criteria, Collection<String> recentTopics) {
        return retrievalEngine.recommend(criteria, recentTopics);
    }

    /**
     * Grade with the configured weights and the word range of the prompt's grade tier.
     */
    public GradingOutcome gradeEssay(String essay, PromptRecord prompt) {
        if (prompt == null) {
            return reject("No prompt supplied for the essay");
        }
        return gradeEssay(essay, prompt, weights.forPrompt(prompt));
    }

    public GradingOutcome gradeEssay(String essay, PromptRecord prompt, RubricWeights rubric) {
        try {
            return gradeEssayAsync(essay, prompt, rubric).toCompletableFuture().join();
        } catch (CancellationException | CompletionException e) {
            logger.error("❌ Grading did not complete: {}", e.getMessage());
            return GradingOutcome.failed("Grading did not complete: " + e.getMessage());
        }
    }

    public CompletionStage<GradingOutcome> gradeEssayAsync(String essay, PromptRecord prompt) {
        if (prompt == null) {
            return CompletableFuture.completedFuture(reject("No prompt supplied for the essay"));
        }
        return gradeEssayAsync(essay, prompt, weights.forPrompt(prompt));
    }

    /**
     * Asynchronous grading. Cancelling the returned stage's future abandons the evaluation.
     */
    public CompletionStage<GradingOutcome> gradeEssayAsync(String essay, PromptRecord prompt, RubricWeights rubric) {
        if (essay == null || essay.isBlank()) {
            return CompletableFuture.completedFuture(reject("Essay text is empty"));
        }
        if (prompt == null) {
            return CompletableFuture.completedFuture(reject("No prompt supplied for the essay"));
        }
        if (rubric == null) {
            return CompletableFuture.completedFuture(reject("No rubric weights supplied"));
        }

        CompletableFuture<GradingResult> evaluation;
        try {
            evaluation = pipeline.evaluateAsync(essay, prompt, rubric);
        } catch (InvalidSubmissionException e) {
            return CompletableFuture.completedFuture(reject(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("❌ Could not start grading for prompt {}", prompt.getId(), e);
            return CompletableFuture.completedFuture(GradingOutcome.failed(describe(e)));
        }

        CompletableFuture<GradingOutcome> outcome = evaluation.handle((result, error) -> {
            if (error == null) {
                return GradingOutcome.graded(result);
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof InvalidSubmissionException) {
                return reject(cause.getMessage());
            }
            logger.error("❌ Grading failed for prompt {}", prompt.getId(), cause);
            return GradingOutcome.failed(describe(cause));
        });
        outcome.whenComplete((ignored, error) -> {
            if (outcome.isCancelled()) {
                evaluation.cancel(true);
            }
        });
        return outcome;
    }

    private static GradingOutcome reject(String reason) {
        logger.info("🚫 Rejected submission: {}", reason);
        return GradingOutcome.rejected(reason);
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
