package com.essaycoach.models;

/**
 * A suspected error found by pattern scanning: character offset, span length and what looks wrong
 */
public record GrammarIssue(int offset, int length, String description, String excerpt) {

    @Override
    public String toString() {
        return String.format("[%d] %s (\"%s\")", offset, description, excerpt);
    }
}
