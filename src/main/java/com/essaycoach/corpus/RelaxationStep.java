package com.essaycoach.corpus;

/**
 * Filters applied at each stage of the relaxation chain, strictest first.
 * Grade tier is dropped last because it carries the word-count expectations.
 */
public enum RelaxationStep {
    /** grade, level, and genre/topic when requested */
    EXACT(true, true, true),
    /** grade and level */
    IGNORE_GENRE_TOPIC(true, true, false),
    /** grade only */
    IGNORE_LEVEL(true, false, false),
    /** any record */
    IGNORE_GRADE(false, false, false);

    private final boolean matchGrade;
    private final boolean matchLevel;
    private final boolean matchGenreTopic;

    RelaxationStep(boolean matchGrade, boolean matchLevel, boolean matchGenreTopic) {
        this.matchGrade = matchGrade;
        this.matchLevel = matchLevel;
        this.matchGenreTopic = matchGenreTopic;
    }

    public boolean matchesGrade() {
        return matchGrade;
    }

    public boolean matchesLevel() {
        return matchLevel;
    }

    public boolean matchesGenreTopic() {
        return matchGenreTopic;
    }
}
