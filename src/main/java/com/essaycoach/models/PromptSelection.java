package com.essaycoach.models;

import com.essaycoach.corpus.RelaxationStep;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of prompt retrieval. NO_MATCH is a normal outcome the caller must handle.
 */
public final class PromptSelection {
    private static final PromptSelection NO_MATCH = new PromptSelection(null, 0.0, null);

    private final PromptRecord prompt;
    private final double similarity;
    private final RelaxationStep relaxation;

    private PromptSelection(PromptRecord prompt, double similarity, RelaxationStep relaxation) {
        this.prompt = prompt;
        this.similarity = similarity;
        this.relaxation = relaxation;
    }

    public static PromptSelection matched(PromptRecord prompt, double similarity, RelaxationStep relaxation) {
        return new PromptSelection(Objects.requireNonNull(prompt, "prompt"), similarity,
                Objects.requireNonNull(relaxation, "relaxation"));
    }

    public static PromptSelection noMatch() {
        return NO_MATCH;
    }

    public boolean isMatched() {
        return prompt != null;
    }

    public Optional<PromptRecord> getPrompt() {
        return Optional.ofNullable(prompt);
    }

    public double getSimilarity() {
        return similarity;
    }

    /**
     * Which filters had to be dropped to find the prompt; empty for NO_MATCH.
     */
    public Optional<RelaxationStep> getRelaxation() {
        return Optional.ofNullable(relaxation);
    }

    @Override
    public String toString() {
        if (prompt == null) {
            return "PromptSelection{NO_MATCH}";
        }
        return String.format("PromptSelection{id=%s, similarity=%.3f, relaxation=%s}",
                prompt.getId(), similarity, relaxation);
    }
}
