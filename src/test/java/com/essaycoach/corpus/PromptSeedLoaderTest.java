package com.essaycoach.corpus;

import com.essaycoach.errors.ConfigurationException;
import com.essaycoach.models.GradeTier;
import com.essaycoach.models.PromptRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PromptSeedLoaderTest {

    private final PromptSeedLoader loader = new PromptSeedLoader();

    @Test
    void testSeedsEmptyCorpusOnce() {
        PromptCorpus corpus = new PromptCorpus(new HashingEmbedder());

        assertEquals(5, loader.seedIfEmpty(corpus));
        assertEquals(0, loader.seedIfEmpty(corpus));
        assertEquals(5, corpus.count());

        PromptRecord family = corpus.findById("1").orElseThrow();
        assertEquals("My Family", family.getTitle());
        assertEquals(GradeTier.PRIMARY_SCHOOL, family.getGrade());
        assertEquals(HashingEmbedder.DEFAULT_DIMENSION, family.getEmbeddingDimension());
    }

    @Test
    void testMissingResource() {
        PromptCorpus corpus = new PromptCorpus(new HashingEmbedder());
        assertThrows(ConfigurationException.class, () -> loader.seedIfEmpty(corpus, "no_such_prompts.json"));
        assertEquals(0, corpus.count());
    }
}
