package com.essaycoach.models;

import java.util.Objects;
import java.util.Optional;

/**
 * Filter used to pick a prompt: grade tier and level are required, genre and topic optional
 */
public final class EvaluationCriteria {
    private final GradeTier grade;
    private final ProficiencyLevel level;
    private final String genre;
    private final String topic;

    public EvaluationCriteria(GradeTier grade, ProficiencyLevel level, String genre, String topic) {
        this.grade = Objects.requireNonNull(grade, "grade");
        this.level = Objects.requireNonNull(level, "level");
        this.genre = blankToNull(genre);
        this.topic = blankToNull(topic);
    }

    public EvaluationCriteria(GradeTier grade, ProficiencyLevel level) {
        this(grade, level, null, null);
    }

    public GradeTier getGrade() { return grade; }
    public ProficiencyLevel getLevel() { return level; }
    public Optional<String> getGenre() { return Optional.ofNullable(genre); }
    public Optional<String> getTopic() { return Optional.ofNullable(topic); }

    public boolean hasGenreOrTopic() {
        return genre != null || topic != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvaluationCriteria)) return false;
        EvaluationCriteria that = (EvaluationCriteria) o;
        return grade == that.grade && level == that.level
                && Objects.equals(genre, that.genre) && Objects.equals(topic, that.topic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(grade, level, genre, topic);
    }

    @Override
    public String toString() {
        return "EvaluationCriteria{" +
                "grade=" + grade +
                ", level=" + level +
                ", genre='" + genre + '\'' +
                ", topic='" + topic + '\'' +
                '}';
    }
}
