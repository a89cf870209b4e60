package com.essaycoach.evaluation;

import com.essaycoach.TestData;
import com.essaycoach.errors.InvalidSubmissionException;
import com.essaycoach.errors.JudgmentUnavailableException;
import com.essaycoach.judgment.Judgment;
import com.essaycoach.judgment.JudgmentClient;
import com.essaycoach.models.*;
import com.essaycoach.utils.TextMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluationPipelineTest {

    private static final RubricWeights OPEN_RANGE = new RubricWeights(0.3, 0.3, 0.4, 0, 500);

    private ExecutorService executor;
    private PromptRecord prompt;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        prompt = TestData.familyPrompt();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private EvaluationPipeline pipeline(JudgmentClient client) {
        return new EvaluationPipeline(client, PipelineSettings.defaults(), executor);
    }

    @Test
    void testAllDimensionsJudged() {
        GradingResult result = pipeline(TestData.scripted(Map.of(
                Dimension.GRAMMAR, 27.0, Dimension.VOCABULARY, 24.0, Dimension.CONTENT, 36.0)))
                .evaluate(TestData.FAMILY_ESSAY, prompt, RubricWeights.defaults().forPrompt(prompt));

        assertFalse(result.isDegraded());
        for (Dimension dimension : Dimension.values()) {
            assertEquals(DimensionScore.Status.JUDGED, result.getScore(dimension).status());
        }
        assertEquals(36.0, result.getContent().score());
        assertTrue(result.isLengthCompliant());
        assertEquals(GradingResult.calculateLetterGrade(result.getOverallScore()), result.getGrade());
        assertTrue(result.getOverallFeedback().contains("Content: content feedback"));
        assertTrue(result.suggestionsFrom("content").contains("content suggestion"));
    }

    @Test
    void testGrammarFallsBackToPatternPenalty() {
        GradingResult result = pipeline(TestData.scripted(Map.of(
                Dimension.VOCABULARY, 20.0, Dimension.CONTENT, 30.0)))
                .evaluate(TestData.TWO_ISSUE_ESSAY, prompt, OPEN_RANGE);

        assertEquals(2, result.getGrammarErrors().size());
        assertEquals(20.0, result.getGrammar().score());
        assertEquals(DimensionScore.Status.DEGRADED, result.getGrammar().status());
        assertEquals(EnumSet.of(Dimension.GRAMMAR), result.getDegradedDimensions());
        assertTrue(result.getUnavailableDimensions().isEmpty());
        // every word is distinct, so the vocabulary judgment gets the +3 bonus
        assertEquals(23.0, result.getVocabulary().score());
        assertEquals(73.0, result.getOverallScore());
    }

    @Test
    void testJudgedGrammarKeepsScoreForFewFindings() {
        GradingResult result = pipeline(TestData.scripted(Map.of(
                Dimension.GRAMMAR, 25.0, Dimension.VOCABULARY, 20.0, Dimension.CONTENT, 30.0)))
                .evaluate(TestData.TWO_ISSUE_ESSAY, prompt, OPEN_RANGE);

        assertEquals(25.0, result.getGrammar().score());
        assertTrue(result.getGrammar().issues().contains("grammar issue"));
        assertEquals(3, result.getGrammar().issues().size());
    }

    @Test
    void testContentUnavailableRenormalisesOverall() {
        GradingResult result = pipeline(TestData.scripted(Map.of(
                Dimension.GRAMMAR, 25.0, Dimension.VOCABULARY, 20.0)))
                .evaluate(TestData.TWO_ISSUE_ESSAY, prompt, OPEN_RANGE);

        assertFalse(result.getContent().isAvailable());
        assertEquals(EnumSet.of(Dimension.CONTENT), result.getUnavailableDimensions());
        double expected = ScoreCalculator.overall(
                List.of(result.getGrammar(), result.getVocabulary(), result.getContent()), OPEN_RANGE);
        assertEquals(expected, result.getOverallScore());
        assertEquals(80.0, result.getOverallScore());
        assertTrue(result.getOverallFeedback().contains("Not scored: content"));
    }

    @Test
    void testNoJudgeAtAll() {
        GradingResult result = pipeline(TestData.scripted(Map.of()))
                .evaluate(TestData.TWO_ISSUE_ESSAY, prompt, OPEN_RANGE);

        assertEquals(EnumSet.of(Dimension.GRAMMAR, Dimension.VOCABULARY), result.getDegradedDimensions());
        assertEquals(EnumSet.of(Dimension.CONTENT), result.getUnavailableDimensions());
        assertEquals(30.0, result.getVocabulary().score());
        assertTrue(result.getOverallScore() >= 0 && result.getOverallScore() <= 100);
    }

    @Test
    void testOutOfRangeScoreTreatedAsFailure() {
        GradingResult result = pipeline(TestData.scripted(Map.of(
                Dimension.GRAMMAR, 45.0, Dimension.VOCABULARY, 20.0, Dimension.CONTENT, 30.0)))
                .evaluate(TestData.TWO_ISSUE_ESSAY, prompt, OPEN_RANGE);

        assertEquals(DimensionScore.Status.DEGRADED, result.getGrammar().status());
        assertTrue(result.getGrammar().score() <= Dimension.GRAMMAR.getCeiling());
    }

    @Test
    void testShortEssayFlagsLength() {
        GradingResult result = pipeline(TestData.scripted(Map.of(
                Dimension.GRAMMAR, 25.0, Dimension.VOCABULARY, 20.0, Dimension.CONTENT, 30.0)))
                .evaluate(TestData.SHORT_ESSAY, prompt, new RubricWeights(0.3, 0.3, 0.4, 25, 500));

        assertEquals(24, result.getWordCount());
        assertFalse(result.isLengthCompliant());
        assertEquals(List.of("The essay has 24 words; write at least 25."),
                result.suggestionsFrom(SourcedNote.LENGTH));
        assertTrue(result.getOverallFeedback().contains("length is outside the expected range"));
    }

    @Test
    void testSlowJudgmentTimesOut() {
        JudgmentClient slowGrammar = (dimension, essayText, judgedPrompt, rubricGuidance) -> {
            if (dimension == Dimension.GRAMMAR) {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new JudgmentUnavailableException(dimension, "interrupted");
                }
            }
            return new Judgment(20.0, "ok", List.of(), List.of());
        };
        EvaluationPipeline pipeline = new EvaluationPipeline(slowGrammar,
                new PipelineSettings(5, Duration.ofMillis(200)), executor);

        long started = System.nanoTime();
        GradingResult result = pipeline.evaluate(TestData.TWO_ISSUE_ESSAY, prompt, OPEN_RANGE);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(DimensionScore.Status.DEGRADED, result.getGrammar().status());
        assertTrue(result.getGrammar().feedback().contains("timed out after 200 ms"));
        assertEquals(DimensionScore.Status.JUDGED, result.getContent().status());
        assertTrue(elapsedMillis < 1500, "took " + elapsedMillis + " ms");
    }

    @Test
    void testStalledEvaluationLeavesPoolForTheNext() {
        JudgmentClient stallsOnSlowEssays = (dimension, essayText, judgedPrompt, rubricGuidance) -> {
            if (essayText.startsWith("Slow")) {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new JudgmentUnavailableException(dimension, "interrupted");
                }
            }
            return new Judgment(20.0, "ok", List.of(), List.of());
        };
        EvaluationPipeline pipeline = new EvaluationPipeline(stallsOnSlowEssays,
                new PipelineSettings(5, Duration.ofMillis(300)), executor);

        CompletableFuture<GradingResult> stalled =
                pipeline.evaluateAsync("Slow start. " + TestData.FAMILY_ESSAY, prompt, OPEN_RANGE);
        long started = System.nanoTime();
        GradingResult next = pipeline.evaluate(TestData.FAMILY_ESSAY, prompt, OPEN_RANGE);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertFalse(next.isDegraded(), next.getOverallFeedback());
        assertTrue(next.getUnavailableDimensions().isEmpty());
        assertEquals(20.0, next.getContent().score());
        assertTrue(elapsedMillis < 2500, "took " + elapsedMillis + " ms");

        GradingResult first = stalled.join();
        assertEquals(EnumSet.of(Dimension.GRAMMAR, Dimension.VOCABULARY), first.getDegradedDimensions());
        assertEquals(EnumSet.of(Dimension.CONTENT), first.getUnavailableDimensions());
    }

    @Test
    void testGrammarPenaltyUsesFullFindingCount() {
        String essay = "He don't run. ".repeat(12);

        GradingResult judged = pipeline(TestData.scripted(Map.of(
                Dimension.GRAMMAR, 25.0, Dimension.VOCABULARY, 20.0, Dimension.CONTENT, 30.0)))
                .evaluate(essay, prompt, OPEN_RANGE);
        assertEquals(TextMetrics.MAX_FINDINGS, judged.getGrammarErrors().size());
        assertEquals(17.0, judged.getGrammar().score());

        GradingResult estimated = new EvaluationPipeline(TestData.scripted(Map.of()),
                new PipelineSettings(1, Duration.ofSeconds(5)), executor)
                .evaluate(essay, prompt, OPEN_RANGE);
        assertEquals(DimensionScore.Status.DEGRADED, estimated.getGrammar().status());
        assertEquals(18.0, estimated.getGrammar().score());
        assertTrue(estimated.getGrammar().feedback().contains("12 pattern finding(s)"));
    }

    @Test
    void testCancellationCompletesResult() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        JudgmentClient blocking = (dimension, essayText, judgedPrompt, rubricGuidance) -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new JudgmentUnavailableException(dimension, "interrupted");
        };

        CompletableFuture<GradingResult> future = pipeline(blocking)
                .evaluateAsync(TestData.TWO_ISSUE_ESSAY, prompt, OPEN_RANGE);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(future.cancel(true));
        assertTrue(future.isCancelled());
    }

    @Test
    void testInvalidSubmissionRejectedBeforeScheduling() {
        EvaluationPipeline pipeline = pipeline(TestData.scripted(Map.of()));
        assertThrows(InvalidSubmissionException.class, () -> pipeline.evaluateAsync("   ", prompt, OPEN_RANGE));
        assertThrows(InvalidSubmissionException.class, () -> pipeline.evaluateAsync(null, prompt, OPEN_RANGE));
        assertThrows(InvalidSubmissionException.class,
                () -> pipeline.evaluateAsync(TestData.FAMILY_ESSAY, null, OPEN_RANGE));
    }

    @Test
    void testContentGuidanceListsRequirements() {
        String guidance = EvaluationPipeline.guidanceFor(Dimension.CONTENT, prompt);
        assertTrue(guidance.contains("Include at least 3 family members"));
        assertTrue(guidance.contains("family, parents, love"));
    }
}
