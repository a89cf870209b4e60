package com.essaycoach.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Complete evaluation of one essay. Built once by the evaluation pipeline and never mutated.
 */
public final class GradingResult {
    private final double overallScore;
    private final String grade;
    private final DimensionScore grammar;
    private final DimensionScore vocabulary;
    private final DimensionScore content;
    private final List<GrammarIssue> grammarErrors;
    private final List<SourcedNote> issues;
    private final List<SourcedNote> suggestions;
    private final String overallFeedback;
    private final int wordCount;
    private final int sentenceCount;
    private final double lexicalDiversity;
    private final boolean lengthCompliant;
    private final Set<Dimension> degradedDimensions;
    private final Set<Dimension> unavailableDimensions;

    @JsonCreator
    public GradingResult(
            @JsonProperty("overallScore") double overallScore,
            @JsonProperty("grade") String grade,
            @JsonProperty("grammar") DimensionScore grammar,
            @JsonProperty("vocabulary") DimensionScore vocabulary,
            @JsonProperty("content") DimensionScore content,
            @JsonProperty("grammarErrors") List<GrammarIssue> grammarErrors,
            @JsonProperty("issues") List<SourcedNote> issues,
            @JsonProperty("suggestions") List<SourcedNote> suggestions,
            @JsonProperty("overallFeedback") String overallFeedback,
            @JsonProperty("wordCount") int wordCount,
            @JsonProperty("sentenceCount") int sentenceCount,
            @JsonProperty("lexicalDiversity") double lexicalDiversity,
            @JsonProperty("lengthCompliant") boolean lengthCompliant,
            @JsonProperty("degradedDimensions") Set<Dimension> degradedDimensions,
            @JsonProperty("unavailableDimensions") Set<Dimension> unavailableDimensions) {
        this.overallScore = overallScore;
        this.grade = grade;
        this.grammar = grammar;
        this.vocabulary = vocabulary;
        this.content = content;
        this.grammarErrors = grammarErrors == null ? List.of() : List.copyOf(grammarErrors);
        this.issues = issues == null ? List.of() : List.copyOf(issues);
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        this.overallFeedback = overallFeedback;
        this.wordCount = wordCount;
        this.sentenceCount = sentenceCount;
        this.lexicalDiversity = lexicalDiversity;
        this.lengthCompliant = lengthCompliant;
        this.degradedDimensions = immutableCopy(degradedDimensions);
        this.unavailableDimensions = immutableCopy(unavailableDimensions);
    }

    public double getOverallScore() { return overallScore; }
    public String getGrade() { return grade; }
    public DimensionScore getGrammar() { return grammar; }
    public DimensionScore getVocabulary() { return vocabulary; }
    public DimensionScore getContent() { return content; }
    public List<GrammarIssue> getGrammarErrors() { return grammarErrors; }
    public List<SourcedNote> getIssues() { return issues; }
    public List<SourcedNote> getSuggestions() { return suggestions; }
    public String getOverallFeedback() { return overallFeedback; }
    public int getWordCount() { return wordCount; }
    public int getSentenceCount() { return sentenceCount; }
    public double getLexicalDiversity() { return lexicalDiversity; }
    public boolean isLengthCompliant() { return lengthCompliant; }
    public Set<Dimension> getDegradedDimensions() { return degradedDimensions; }
    public Set<Dimension> getUnavailableDimensions() { return unavailableDimensions; }

    /**
     * True when at least one dimension fell back to deterministic scoring or could not be scored.
     */
    @JsonIgnore
    public boolean isDegraded() {
        return !degradedDimensions.isEmpty() || !unavailableDimensions.isEmpty();
    }

    @JsonIgnore
    public DimensionScore getScore(Dimension dimension) {
        switch (dimension) {
            case GRAMMAR:
                return grammar;
            case VOCABULARY:
                return vocabulary;
            case CONTENT:
                return content;
            default:
                throw new IllegalArgumentException("Unknown dimension: " + dimension);
        }
    }

    /**
     * Suggestions produced by one source tag, in order.
     */
    public List<String> suggestionsFrom(String source) {
        return suggestions.stream()
                .filter(note -> note.source().equals(source))
                .map(SourcedNote::text)
                .toList();
    }

    /**
     * Letter grade for a 0-100 score
     */
    public static String calculateLetterGrade(double percentage) {
        if (percentage >= 93) return "A";
        else if (percentage >= 90) return "A-";
        else if (percentage >= 87) return "B+";
        else if (percentage >= 83) return "B";
        else if (percentage >= 80) return "B-";
        else if (percentage >= 77) return "C+";
        else if (percentage >= 73) return "C";
        else if (percentage >= 70) return "C-";
        else if (percentage >= 67) return "D+";
        else if (percentage >= 63) return "D";
        else if (percentage >= 60) return "D-";
        else return "F";
    }

    private static Set<Dimension> immutableCopy(Set<Dimension> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(dimensions));
    }

    @Override
    public String toString() {
        return "GradingResult{" +
                "overallScore=" + String.format("%.1f", overallScore) +
                ", grade='" + grade + '\'' +
                ", " + grammar +
                ", " + vocabulary +
                ", " + content +
                ", wordCount=" + wordCount +
                ", lengthCompliant=" + lengthCompliant +
                ", degraded=" + degradedDimensions +
                ", unavailable=" + unavailableDimensions +
                '}';
    }
}
