package com.essaycoach.corpus;

import java.util.List;
import java.util.Optional;

/**
 * Ranked hits from a corpus search and the relaxation step that produced them
 */
public record SearchResult(List<ScoredPrompt> hits, RelaxationStep relaxation) {

    private static final SearchResult EMPTY = new SearchResult(List.of(), null);

    public SearchResult {
        hits = List.copyOf(hits);
    }

    public static SearchResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    public Optional<ScoredPrompt> best() {
        return hits.isEmpty() ? Optional.empty() : Optional.of(hits.get(0));
    }
}
