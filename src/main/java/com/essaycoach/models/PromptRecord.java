package com.essaycoach.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A writing prompt with its metadata and, once stored in a corpus, its embedding.
 * Instances are immutable; the embedding array is copied on the way in and out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PromptRecord {
    private final String id;
    private final String title;
    private final String prompt;
    private final GradeTier grade;
    private final ProficiencyLevel level;
    private final String genre;
    private final String topic;
    private final List<String> requirements;
    private final List<String> keywords;
    private final double[] embedding;

    @JsonCreator
    public PromptRecord(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("prompt") String prompt,
            @JsonProperty("grade") GradeTier grade,
            @JsonProperty("level") ProficiencyLevel level,
            @JsonProperty("genre") String genre,
            @JsonProperty("topic") String topic,
            @JsonProperty("requirements") List<String> requirements,
            @JsonProperty("keywords") List<String> keywords,
            @JsonProperty("embedding") double[] embedding) {
        this.id = id;
        this.title = title;
        this.prompt = prompt;
        this.grade = grade;
        this.level = level;
        this.genre = genre;
        this.topic = topic;
        this.requirements = requirements == null ? List.of() : List.copyOf(requirements);
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
        this.embedding = embedding == null ? null : embedding.clone();
    }

    public PromptRecord(String id, String title, String prompt, GradeTier grade, ProficiencyLevel level,
                        String genre, String topic, List<String> requirements, List<String> keywords) {
        this(id, title, prompt, grade, level, genre, topic, requirements, keywords, null);
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getPrompt() { return prompt; }
    public GradeTier getGrade() { return grade; }
    public ProficiencyLevel getLevel() { return level; }
    public String getGenre() { return genre; }
    public String getTopic() { return topic; }
    public List<String> getRequirements() { return requirements; }
    public List<String> getKeywords() { return keywords; }

    public double[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    @JsonIgnore
    public boolean hasEmbedding() {
        return embedding != null;
    }

    @JsonIgnore
    public int getEmbeddingDimension() {
        return embedding == null ? 0 : embedding.length;
    }

    @JsonIgnore
    public int getMinWords() {
        return grade == null ? 0 : grade.getMinWords();
    }

    @JsonIgnore
    public int getMaxWords() {
        return grade == null ? Integer.MAX_VALUE : grade.getMaxWords();
    }

    /**
     * Cosine similarity against a query vector of the same dimension.
     * Returns 0 when either vector has zero length.
     */
    public double cosineSimilarity(double[] query) {
        if (embedding == null || query == null || query.length != embedding.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < embedding.length; i++) {
            dot += embedding[i] * query[i];
            normA += embedding[i] * embedding[i];
            normB += query[i] * query[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Copy of this record carrying the given embedding.
     */
    public PromptRecord withEmbedding(double[] vector) {
        return new PromptRecord(id, title, prompt, grade, level, genre, topic, requirements, keywords, vector);
    }

    /**
     * Text the embedding is computed from: title, prompt, metadata, requirements and keywords.
     */
    @JsonIgnore
    public String toEmbeddingText() {
        StringBuilder text = new StringBuilder();
        text.append("Title: ").append(nullToEmpty(title)).append('\n');
        text.append("Prompt: ").append(nullToEmpty(prompt)).append('\n');
        text.append("Grade: ").append(grade == null ? "" : grade.getValue()).append('\n');
        text.append("Level: ").append(level == null ? "" : level.getValue()).append('\n');
        text.append("Genre: ").append(nullToEmpty(genre)).append('\n');
        text.append("Topic: ").append(nullToEmpty(topic)).append('\n');
        if (!requirements.isEmpty()) {
            text.append("Requirements:\n");
            for (String requirement : requirements) {
                text.append("- ").append(requirement).append('\n');
            }
        }
        if (!keywords.isEmpty()) {
            text.append("Keywords: ").append(String.join(", ", keywords));
        }
        return text.toString();
    }

    /**
     * Names of required fields that are missing or blank. Empty when the record is complete.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(id)) missing.add("id");
        if (isBlank(title)) missing.add("title");
        if (isBlank(prompt)) missing.add("prompt");
        if (grade == null) missing.add("grade");
        if (level == null) missing.add("level");
        if (isBlank(genre)) missing.add("genre");
        if (isBlank(topic)) missing.add("topic");
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PromptRecord)) return false;
        PromptRecord that = (PromptRecord) o;
        return Objects.equals(id, that.id)
                && Objects.equals(title, that.title)
                && Objects.equals(prompt, that.prompt)
                && grade == that.grade
                && level == that.level
                && Objects.equals(genre, that.genre)
                && Objects.equals(topic, that.topic)
                && requirements.equals(that.requirements)
                && keywords.equals(that.keywords)
                && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, title, prompt, grade, level, genre, topic, requirements, keywords);
        result = 31 * result + Arrays.hashCode(embedding);
        return result;
    }

    @Override
    public String toString() {
        return "PromptRecord{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", grade=" + grade +
                ", level=" + level +
                ", genre='" + genre + '\'' +
                ", topic='" + topic + '\'' +
                ", embeddingDimension=" + getEmbeddingDimension() +
                '}';
    }
}
