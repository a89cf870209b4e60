package com.essaycoach.errors;

/**
 * Base type for failures raised by the prompt corpus, retrieval and grading code
 */
public class EssayCoachException extends RuntimeException {

    public EssayCoachException(String message) {
        super(message);
    }

    public EssayCoachException(String message, Throwable cause) {
        super(message, cause);
    }
}
