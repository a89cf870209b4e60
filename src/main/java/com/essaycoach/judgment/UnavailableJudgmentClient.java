package com.essaycoach.judgment;

import com.essaycoach.errors.JudgmentUnavailableException;
import com.essaycoach.models.Dimension;
import com.essaycoach.models.PromptRecord;

/**
 * Judgment client for offline operation. Every call fails, so grading falls back
 * to deterministic scores and content is reported unavailable.
 */
public class UnavailableJudgmentClient implements JudgmentClient {

    private final String reason;

    public UnavailableJudgmentClient() {
        this("No judgment model configured");
    }

    public UnavailableJudgmentClient(String reason) {
        this.reason = reason;
    }

    @Override
    public Judgment judge(Dimension dimension, String essayText, PromptRecord prompt, String rubricGuidance)
            throws JudgmentUnavailableException {
        throw new JudgmentUnavailableException(dimension, reason);
    }
}
