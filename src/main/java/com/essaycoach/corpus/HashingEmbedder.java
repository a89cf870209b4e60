package com.essaycoach.corpus;

import com.essaycoach.utils.TextMetrics;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Local embedder using the hashing trick over word unigrams and bigrams.
 * Deterministic across runs and JVMs, so it is used for tests and for offline operation.
 */
public class HashingEmbedder implements Embedder {

    public static final int DEFAULT_DIMENSION = 256;

    private static final Set<String> STOPWORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "in", "is", "it",
        "its", "of", "on", "that", "the", "to", "was", "with", "this", "your", "you", "about");

    private final int dimension;

    public HashingEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbedder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        List<String> tokens = TextMetrics.words(text).stream()
                .map(word -> word.toLowerCase(Locale.ROOT))
                .filter(word -> !STOPWORDS.contains(word))
                .toList();
        for (int i = 0; i < tokens.size(); i++) {
            add(vector, tokens.get(i), 1.0);
            if (i + 1 < tokens.size()) {
                add(vector, tokens.get(i) + " " + tokens.get(i + 1), 0.5);
            }
        }
        normalize(vector);
        return vector;
    }

    private void add(double[] vector, String feature, double weight) {
        int bucket = Math.floorMod(feature.hashCode(), dimension);
        double sign = (("#" + feature).hashCode() & 1) == 0 ? 1.0 : -1.0;
        vector[bucket] += sign * weight;
    }

    private static void normalize(double[] vector) {
        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        if (norm == 0) {
            return;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
