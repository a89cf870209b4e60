package com.essaycoach.evaluation;

import com.essaycoach.errors.ConfigurationException;

import java.time.Duration;

/**
 * Tuning for the evaluation pipeline: points lost per pattern finding when grammar
 * falls back to deterministic scoring, and how long each judgment call may take.
 */
public record PipelineSettings(int penaltyPerIssue, Duration judgmentTimeout) {

    public PipelineSettings {
        if (penaltyPerIssue < 0) {
            throw new ConfigurationException("penaltyPerIssue must not be negative: " + penaltyPerIssue);
        }
        if (judgmentTimeout == null || judgmentTimeout.isZero() || judgmentTimeout.isNegative()) {
            throw new ConfigurationException("judgmentTimeout must be positive: " + judgmentTimeout);
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(5, Duration.ofSeconds(30));
    }
}
