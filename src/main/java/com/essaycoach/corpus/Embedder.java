package com.essaycoach.corpus;

/**
 * Turns text into a fixed-dimension vector for similarity search.
 * Implementations may call out to a remote model; callers must not hold locks while embedding.
 */
public interface Embedder {

    /**
     * Length of every vector this embedder produces.
     */
    int dimension();

    /**
     * @throws com.essaycoach.errors.EmbeddingException if no vector can be produced
     */
    double[] embed(String text);
}
