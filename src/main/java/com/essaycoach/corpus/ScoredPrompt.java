package com.essaycoach.corpus;

import com.essaycoach.models.PromptRecord;

/**
 * A search hit and its cosine similarity to the query (0 when no query was given)
 */
public record ScoredPrompt(PromptRecord prompt, double similarity) {
}
