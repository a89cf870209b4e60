package com.essaycoach.models;

import java.util.Objects;
import java.util.Optional;

/**
 * Criteria plus an optional free-text query for similarity ranking
 */
public record RetrievalRequest(EvaluationCriteria criteria, String freeTextQuery) {

    public RetrievalRequest {
        Objects.requireNonNull(criteria, "criteria");
    }

    public static RetrievalRequest of(EvaluationCriteria criteria) {
        return new RetrievalRequest(criteria, null);
    }

    public Optional<String> query() {
        return freeTextQuery == null || freeTextQuery.isBlank()
                ? Optional.empty()
                : Optional.of(freeTextQuery.trim());
    }
}
