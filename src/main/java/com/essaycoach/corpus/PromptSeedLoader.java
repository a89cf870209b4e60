package com.essaycoach.corpus;

import com.essaycoach.errors.ConfigurationException;
import com.essaycoach.models.PromptRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Fills an empty corpus with the prompts bundled on the classpath.
 * Seed records carry no embeddings; the corpus computes them on insert.
 */
public class PromptSeedLoader {
    private static final Logger logger = LoggerFactory.getLogger(PromptSeedLoader.class);

    public static final String DEFAULT_RESOURCE = "sample_prompts.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Seed from {@link #DEFAULT_RESOURCE} when the corpus holds no prompts.
     *
     * @return number of prompts inserted, 0 when the corpus was already populated
     */
    public int seedIfEmpty(PromptCorpus corpus) {
        return seedIfEmpty(corpus, DEFAULT_RESOURCE);
    }

    public int seedIfEmpty(PromptCorpus corpus, String resource) {
        if (corpus.count() > 0) {
            logger.debug("Corpus already holds {} prompt(s), skipping seed", corpus.count());
            return 0;
        }
        List<PromptRecord> seeds = readResource(resource);
        for (PromptRecord seed : seeds) {
            corpus.insert(seed);
        }
        logger.info("🌱 Seeded corpus with {} prompt(s) from {}", seeds.size(), resource);
        return seeds.size();
    }

    List<PromptRecord> readResource(String resource) {
        try (InputStream in = PromptSeedLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Seed resource not found on classpath: " + resource);
            }
            return objectMapper.readValue(in, new TypeReference<List<PromptRecord>>() {});
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read seed resource " + resource + ": " + e.getMessage(), e);
        }
    }
}
