package com.essaycoach.errors;

/**
 * Grading input rejected before any work began (empty essay, missing prompt)
 */
public class InvalidSubmissionException extends EssayCoachException {

    public InvalidSubmissionException(String message) {
        super(message);
    }
}
