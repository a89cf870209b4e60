package com.essaycoach.errors;

/**
 * Malformed configuration, such as rubric weights that do not sum to 1.0.
 * Raised while settings are built, before any essay is processed.
 */
public class ConfigurationException extends EssayCoachException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
