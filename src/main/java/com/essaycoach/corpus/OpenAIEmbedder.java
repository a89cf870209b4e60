package com.essaycoach.corpus;

import com.essaycoach.errors.EmbeddingException;
import com.essaycoach.utils.OpenAIClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Embedder backed by an OpenAI-compatible embeddings endpoint
 */
public class OpenAIEmbedder implements Embedder {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIEmbedder.class);

    private final OpenAIClient client;
    private final String model;
    private final int dimension;

    public OpenAIEmbedder(OpenAIClient client, String model, int dimension) {
        this.client = client;
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public double[] embed(String text) {
        try {
            double[] vector = client.embedding(model, text == null ? "" : text, dimension);
            if (vector.length != dimension) {
                throw new EmbeddingException("Embedding model " + model + " returned " + vector.length
                        + " values, expected " + dimension);
            }
            return vector;
        } catch (IOException e) {
            logger.error("Embedding request failed for model {}: {}", model, e.getMessage());
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        }
    }
}
