package com.essaycoach.errors;

import com.essaycoach.models.Dimension;

/**
 * The judgment model failed, timed out or returned something unusable for one dimension.
 * Checked so that every caller of a judgment client decides how to degrade.
 */
public class JudgmentUnavailableException extends Exception {
    private final Dimension dimension;

    public JudgmentUnavailableException(Dimension dimension, String message) {
        super(message);
        this.dimension = dimension;
    }

    public JudgmentUnavailableException(Dimension dimension, String message, Throwable cause) {
        super(message, cause);
        this.dimension = dimension;
    }

    public Dimension getDimension() {
        return dimension;
    }
}
