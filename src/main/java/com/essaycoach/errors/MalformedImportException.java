package com.essaycoach.errors;

import java.util.List;

/**
 * Corpus import rejected. The corpus keeps the state it had before the import started.
 */
public class MalformedImportException extends EssayCoachException {
    private final List<String> problems;

    public MalformedImportException(String message) {
        this(message, List.of(), null);
    }

    public MalformedImportException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public MalformedImportException(String message, List<String> problems) {
        this(message, problems, null);
    }

    private MalformedImportException(String message, List<String> problems, Throwable cause) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems), cause);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
