package com.essaycoach.config;

import com.essaycoach.errors.ConfigurationException;
import com.essaycoach.evaluation.PipelineSettings;
import com.essaycoach.models.RubricWeights;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Settings read from the {@code essay-coach} block of {@code application.conf}.
 * Everything is validated here, so a bad rubric fails at startup rather than mid-grading.
 */
public final class CoachSettings {

    public static final String ROOT = "essay-coach";

    private final RubricWeights weights;
    private final PipelineSettings pipeline;
    private final int judgmentThreads;
    private final String openAiBaseUrl;
    private final String chatModel;
    private final int maxTokens;
    private final Duration requestTimeout;
    private final String embeddingModel;
    private final int remoteEmbeddingDimension;
    private final int localEmbeddingDimension;
    private final String seedResource;
    private final String corpusFile;
    private final String reportFile;

    private CoachSettings(Config config) {
        this.weights = new RubricWeights(
                config.getDouble("rubric.grammar-weight"),
                config.getDouble("rubric.vocabulary-weight"),
                config.getDouble("rubric.content-weight"),
                config.getInt("rubric.min-words"),
                config.getInt("rubric.max-words"));
        this.pipeline = new PipelineSettings(
                config.getInt("pipeline.penalty-per-issue"),
                config.getDuration("pipeline.judgment-timeout"));
        this.judgmentThreads = config.getInt("pipeline.judgment-threads");
        if (judgmentThreads <= 0) {
            throw new ConfigurationException("pipeline.judgment-threads must be positive: " + judgmentThreads);
        }
        this.openAiBaseUrl = config.getString("openai.base-url");
        this.chatModel = config.getString("openai.chat-model");
        this.maxTokens = config.getInt("openai.max-tokens");
        this.requestTimeout = config.getDuration("openai.request-timeout");
        this.embeddingModel = config.getString("openai.embedding-model");
        this.remoteEmbeddingDimension = config.getInt("openai.embedding-dimension");
        this.localEmbeddingDimension = config.getInt("corpus.local-embedding-dimension");
        this.seedResource = config.getString("corpus.seed-resource");
        this.corpusFile = config.hasPath("corpus.file") ? config.getString("corpus.file") : null;
        this.reportFile = config.getString("report.csv-file");
    }

    /**
     * Settings from {@code application.conf} on the classpath, with system property overrides.
     */
    public static CoachSettings load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * @throws ConfigurationException if a setting is missing, mistyped or invalid
     */
    public static CoachSettings fromConfig(Config root) {
        try {
            return new CoachSettings(root.getConfig(ROOT));
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid essay-coach configuration: " + e.getMessage(), e);
        }
    }

    public RubricWeights getWeights() { return weights; }
    public PipelineSettings getPipeline() { return pipeline; }
    public int getJudgmentThreads() { return judgmentThreads; }
    public String getOpenAiBaseUrl() { return openAiBaseUrl; }
    public String getChatModel() { return chatModel; }
    public int getMaxTokens() { return maxTokens; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public String getEmbeddingModel() { return embeddingModel; }
    public int getRemoteEmbeddingDimension() { return remoteEmbeddingDimension; }
    public int getLocalEmbeddingDimension() { return localEmbeddingDimension; }
    public String getSeedResource() { return seedResource; }

    /**
     * JSON file the corpus is loaded from and saved to, when configured
     */
    public Optional<String> getCorpusFile() {
        return Optional.ofNullable(corpusFile);
    }

    public String getReportFile() { return reportFile; }
}
