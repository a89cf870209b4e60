package com.essaycoach.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.essaycoach.TestData;
import com.essaycoach.corpus.HashingEmbedder;
import com.essaycoach.corpus.PromptCorpus;
import com.essaycoach.corpus.PromptSeedLoader;
import com.essaycoach.evaluation.EvaluationPipeline;
import com.essaycoach.evaluation.PipelineSettings;
import com.essaycoach.models.*;
import com.essaycoach.retrieval.RetrievalEngine;
import com.essaycoach.workflow.WorkflowCoordinator;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class EssayCoachActorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();
    private static ExecutorService executor;
    private static ActorRef<CoachMessages.Command> coach;

    @BeforeAll
    static void setUp() {
        executor = Executors.newFixedThreadPool(3);
        PromptCorpus corpus = new PromptCorpus(new HashingEmbedder());
        new PromptSeedLoader().seedIfEmpty(corpus);
        EvaluationPipeline pipeline = new EvaluationPipeline(
                TestData.scripted(Map.of(Dimension.GRAMMAR, 26.0, Dimension.VOCABULARY, 22.0)),
                PipelineSettings.defaults(), executor);
        WorkflowCoordinator coordinator = new WorkflowCoordinator(
                new RetrievalEngine(corpus), pipeline, RubricWeights.defaults());
        coach = testKit.spawn(EssayCoachActor.create(coordinator), "essay-coach");
    }

    @AfterAll
    static void tearDown() {
        testKit.shutdownTestKit();
        executor.shutdownNow();
    }

    @Test
    void testSelectPrompt() {
        TestProbe<CoachMessages.PromptSelected> probe = testKit.createTestProbe();

        coach.tell(new CoachMessages.SelectPrompt(
                new EvaluationCriteria(GradeTier.HIGH_SCHOOL, ProficiencyLevel.ADVANCED, "opinion", null), probe.getRef()));

        PromptSelection selection = probe.receiveMessage(Duration.ofSeconds(5)).getSelection();
        assertTrue(selection.isMatched());
        assertEquals("5", selection.getPrompt().orElseThrow().getId());
    }

    @Test
    void testSelectWithoutCriteriaIsNoMatch() {
        TestProbe<CoachMessages.PromptSelected> probe = testKit.createTestProbe();

        coach.tell(new CoachMessages.SelectPrompt(null, probe.getRef()));

        assertFalse(probe.receiveMessage(Duration.ofSeconds(5)).getSelection().isMatched());
    }

    @Test
    void testGradeEssay() {
        TestProbe<CoachMessages.EssayGraded> probe = testKit.createTestProbe();

        coach.tell(new CoachMessages.GradeEssay(TestData.FAMILY_ESSAY, TestData.familyPrompt(), probe.getRef()));

        GradingOutcome outcome = probe.receiveMessage(Duration.ofSeconds(10)).getOutcome();
        assertEquals(GradingOutcome.Kind.GRADED, outcome.getKind());
        GradingResult result = outcome.getResult().orElseThrow();
        assertTrue(result.getUnavailableDimensions().contains(Dimension.CONTENT));
        assertEquals(26.0, result.getGrammar().score());
    }

    @Test
    void testGradeEmptyEssayIsRejected() {
        TestProbe<CoachMessages.EssayGraded> probe = testKit.createTestProbe();

        coach.tell(new CoachMessages.GradeEssay("", TestData.familyPrompt(), RubricWeights.defaults(), probe.getRef()));

        assertEquals(GradingOutcome.Kind.REJECTED, probe.receiveMessage(Duration.ofSeconds(5)).getOutcome().getKind());
    }
}
