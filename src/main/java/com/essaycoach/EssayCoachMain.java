package com.essaycoach;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import com.essaycoach.actors.CoachMessages;
import com.essaycoach.actors.EssayCoachActor;
import com.essaycoach.config.CoachSettings;
import com.essaycoach.corpus.*;
import com.essaycoach.evaluation.EvaluationPipeline;
import com.essaycoach.judgment.JudgmentClient;
import com.essaycoach.judgment.OpenAIJudgmentClient;
import com.essaycoach.judgment.UnavailableJudgmentClient;
import com.essaycoach.models.EvaluationCriteria;
import com.essaycoach.models.GradingOutcome;
import com.essaycoach.models.GradingResult;
import com.essaycoach.models.PromptRecord;
import com.essaycoach.retrieval.CriteriaNormalizer;
import com.essaycoach.retrieval.RetrievalEngine;
import com.essaycoach.utils.ApiKeyLoader;
import com.essaycoach.utils.CsvReportWriter;
import com.essaycoach.utils.OpenAIClient;
import com.essaycoach.workflow.WorkflowCoordinator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point.
 *
 * <pre>
 *   select    &lt;grade&gt; &lt;level&gt; [genre] [topic]
 *   grade     &lt;essay-file&gt; &lt;grade&gt; &lt;level&gt; [genre] [topic]
 *   recommend &lt;grade&gt; &lt;level&gt; [recent-topic ...]
 *   export    &lt;corpus-file.json&gt;
 * </pre>
 */
public class EssayCoachMain {
    private static final Logger logger = LoggerFactory.getLogger(EssayCoachMain.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static void main(String[] args) {
        if (args.length < 1) {
            printUsage();
            return;
        }

        CoachSettings settings = CoachSettings.load();
        ExecutorService judgmentExecutor = Executors.newFixedThreadPool(settings.getJudgmentThreads());
        try {
            Application app = Application.build(settings, new ApiKeyLoader().loadOpenAIKey(), judgmentExecutor);
            int status = run(app, settings, args);
            if (status != 0) {
                System.exit(status);
            }
        } catch (Exception e) {
            System.err.println("❌ " + e.getMessage());
            logger.error("Command failed", e);
            System.exit(1);
        } finally {
            judgmentExecutor.shutdownNow();
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java EssayCoachMain <command> [arguments]");
        System.out.println("  select    <grade> <level> [genre] [topic]");
        System.out.println("  grade     <essay-file> <grade> <level> [genre] [topic]");
        System.out.println("  recommend <grade> <level> [recent-topic ...]");
        System.out.println("  export    <corpus-file.json>");
        System.out.println("Grades: primary_school, middle_school, high_school (or 小学, 初中, 高中)");
        System.out.println("Levels: beginner, intermediate, advanced (or 初级, 中级, 高级)");
    }

    static int run(Application app, CoachSettings settings, String[] args) throws Exception {
        CriteriaNormalizer normalizer = new CriteriaNormalizer();
        switch (args[0]) {
            case "select": {
                requireArgs(args, 3);
                EvaluationCriteria criteria = normalizer.normalize(args[1], args[2], arg(args, 3), arg(args, 4));
                PromptRecord prompt = app.coordinator.selectPromptOrGeneric(criteria);
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(prompt.withEmbedding(null)));
                return 0;
            }
            case "grade": {
                requireArgs(args, 4);
                String essay = Files.readString(Paths.get(args[1]));
                EvaluationCriteria criteria = normalizer.normalize(args[2], args[3], arg(args, 4), arg(args, 5));
                PromptRecord prompt = app.coordinator.selectPromptOrGeneric(criteria);
                System.out.println("📝 Prompt: " + prompt.getTitle() + " (" + prompt.getId() + ")");
                GradingOutcome outcome = gradeThroughActor(app.coordinator, settings, essay, prompt);
                return report(outcome, prompt, new CsvReportWriter(Paths.get(settings.getReportFile())));
            }
            case "recommend": {
                requireArgs(args, 3);
                EvaluationCriteria criteria = normalizer.normalize(args[1], args[2], null, null);
                List<String> recent = Arrays.asList(args).subList(3, args.length);
                for (PromptRecord prompt : app.coordinator.recommendPrompts(criteria, recent)) {
                    System.out.println("- [" + prompt.getId() + "] " + prompt.getTitle()
                            + " (" + prompt.getGrade().getValue() + ", " + prompt.getLevel().getValue()
                            + ", " + prompt.getTopic() + ")");
                }
                return 0;
            }
            case "export": {
                requireArgs(args, 2);
                app.corpus.exportTo(Paths.get(args[1]));
                System.out.println("✅ Exported " + app.corpus.count() + " prompt(s) to " + args[1]);
                return 0;
            }
            default:
                printUsage();
                return 2;
        }
    }

    private static GradingOutcome gradeThroughActor(WorkflowCoordinator coordinator, CoachSettings settings,
                                                    String essay, PromptRecord prompt) throws Exception {
        ActorSystem<CoachMessages.Command> system =
                ActorSystem.create(EssayCoachActor.create(coordinator), "essay-coach");
        try {
            Duration timeout = settings.getPipeline().judgmentTimeout().multipliedBy(2).plusSeconds(10);
            CoachMessages.EssayGraded reply = AskPattern.<CoachMessages.Command, CoachMessages.EssayGraded>ask(
                    system,
                    replyTo -> new CoachMessages.GradeEssay(essay, prompt, replyTo),
                    timeout,
                    system.scheduler())
                .toCompletableFuture()
                .get(timeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            return reply.getOutcome();
        } finally {
            system.terminate();
        }
    }

    private static int report(GradingOutcome outcome, PromptRecord prompt, CsvReportWriter writer) throws IOException {
        Optional<GradingResult> graded = outcome.getResult();
        if (graded.isEmpty()) {
            System.err.println("❌ " + outcome.getKind() + ": " + outcome.getReason().orElse("unknown reason"));
            return outcome.getKind() == GradingOutcome.Kind.REJECTED ? 2 : 1;
        }
        GradingResult result = graded.get();
        System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        System.out.println("📊 Score: " + String.format("%.1f", result.getOverallScore()) + "/100 (" + result.getGrade() + ")");
        if (result.isDegraded()) {
            System.out.println("⚠️ Degraded: " + result.getDegradedDimensions() + ", unavailable: " + result.getUnavailableDimensions());
        }
        writer.append(prompt.getId(), result);
        System.out.println("📄 Report: " + writer.getFile());
        return 0;
    }

    private static void requireArgs(String[] args, int count) {
        if (args.length < count) {
            throw new IllegalArgumentException("Missing arguments for '" + args[0] + "', run without arguments for usage");
        }
    }

    private static String arg(String[] args, int index) {
        return args.length > index ? args[index] : null;
    }

    /**
     * The wired components for one run
     */
    static final class Application {
        final PromptCorpus corpus;
        final WorkflowCoordinator coordinator;

        private Application(PromptCorpus corpus, WorkflowCoordinator coordinator) {
            this.corpus = corpus;
            this.coordinator = coordinator;
        }

        static Application build(CoachSettings settings, Optional<String> apiKey, ExecutorService judgmentExecutor)
                throws IOException {
            Embedder embedder;
            JudgmentClient judgmentClient;
            if (apiKey.isPresent()) {
                // HTTP calls end no later than the judgment timeout
                Duration callTimeout = settings.getRequestTimeout().compareTo(settings.getPipeline().judgmentTimeout()) < 0
                        ? settings.getRequestTimeout() : settings.getPipeline().judgmentTimeout();
                OpenAIClient client = new OpenAIClient(apiKey.get(), settings.getOpenAiBaseUrl(),
                        settings.getRequestTimeout(), callTimeout);
                embedder = new OpenAIEmbedder(client, settings.getEmbeddingModel(), settings.getRemoteEmbeddingDimension());
                judgmentClient = new OpenAIJudgmentClient(client, settings.getChatModel(), settings.getMaxTokens());
            } else {
                embedder = new HashingEmbedder(settings.getLocalEmbeddingDimension());
                judgmentClient = new UnavailableJudgmentClient("No OpenAI API key configured");
            }

            PromptCorpus corpus = new PromptCorpus(embedder);
            Optional<Path> corpusFile = settings.getCorpusFile().map(Paths::get);
            if (corpusFile.isPresent() && Files.exists(corpusFile.get())) {
                corpus.importFrom(corpusFile.get());
            } else {
                new PromptSeedLoader().seedIfEmpty(corpus, settings.getSeedResource());
                if (corpusFile.isPresent()) {
                    corpus.exportTo(corpusFile.get());
                }
            }

            EvaluationPipeline pipeline = new EvaluationPipeline(judgmentClient, settings.getPipeline(), judgmentExecutor);
            WorkflowCoordinator coordinator = new WorkflowCoordinator(new RetrievalEngine(corpus), pipeline, settings.getWeights());
            logger.info("🚀 Essay coach ready with {} prompt(s), judgment {}", corpus.count(),
                    apiKey.isPresent() ? "enabled" : "unavailable");
            return new Application(corpus, coordinator);
        }
    }
}
