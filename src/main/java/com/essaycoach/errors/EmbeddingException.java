package com.essaycoach.errors;

/**
 * The embedding model could not turn text into a vector
 */
public class EmbeddingException extends EssayCoachException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
