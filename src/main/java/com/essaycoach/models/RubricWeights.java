package com.essaycoach.models;

import com.essaycoach.errors.ConfigurationException;

/**
 * Relative contribution of each dimension to the overall score, plus the accepted word range.
 * The weights must be non-negative and sum to 1.0; anything else fails at construction.
 */
public record RubricWeights(double grammar, double vocabulary, double content, int minWords, int maxWords) {

    public static final double EPSILON = 1e-6;

    public RubricWeights {
        requireWeight("grammar", grammar);
        requireWeight("vocabulary", vocabulary);
        requireWeight("content", content);
        double sum = grammar + vocabulary + content;
        if (Math.abs(sum - 1.0) > EPSILON) {
            throw new ConfigurationException(String.format(
                "Rubric weights must sum to 1.0 but grammar=%s + vocabulary=%s + content=%s = %s",
                grammar, vocabulary, content, sum));
        }
        if (minWords < 0) {
            throw new ConfigurationException("minWords must not be negative: " + minWords);
        }
        if (maxWords < minWords) {
            throw new ConfigurationException("maxWords (" + maxWords + ") is below minWords (" + minWords + ")");
        }
    }

    /**
     * 0.3 / 0.3 / 0.4 with a 20 to 500 word range.
     */
    public static RubricWeights defaults() {
        return new RubricWeights(0.3, 0.3, 0.4, 20, 500);
    }

    public double weightFor(Dimension dimension) {
        switch (dimension) {
            case GRAMMAR:
                return grammar;
            case VOCABULARY:
                return vocabulary;
            case CONTENT:
                return content;
            default:
                throw new IllegalArgumentException("Unknown dimension: " + dimension);
        }
    }

    public RubricWeights withWordBounds(int min, int max) {
        return new RubricWeights(grammar, vocabulary, content, min, max);
    }

    /**
     * Same weights, word range taken from the prompt's grade tier.
     */
    public RubricWeights forPrompt(PromptRecord prompt) {
        return withWordBounds(prompt.getMinWords(), prompt.getMaxWords());
    }

    public boolean acceptsWordCount(int wordCount) {
        return wordCount >= minWords && wordCount <= maxWords;
    }

    private static void requireWeight(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new ConfigurationException(name + " weight must be a non-negative number: " + value);
        }
    }
}
