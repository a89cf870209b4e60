package com.essaycoach.retrieval;

import com.essaycoach.models.EvaluationCriteria;
import com.essaycoach.models.GradeTier;
import com.essaycoach.models.ProficiencyLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns loosely written grade, level and genre values (English or Chinese) into canonical criteria.
 * Unrecognised grades fall back to middle school and unrecognised levels to intermediate.
 */
public class CriteriaNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(CriteriaNormalizer.class);

    public static final GradeTier DEFAULT_GRADE = GradeTier.MIDDLE_SCHOOL;
    public static final ProficiencyLevel DEFAULT_LEVEL = ProficiencyLevel.INTERMEDIATE;

    /** Genre tags and their Chinese names */
    public static final Map<String, String> GENRES;

    static {
        Map<String, String> genres = new LinkedHashMap<>();
        genres.put("narrative", "记叙文");
        genres.put("descriptive", "描写文");
        genres.put("argumentative", "议论文");
        genres.put("letter", "书信");
        genres.put("opinion", "观点文");
        genres.put("expository", "说明文");
        genres.put("diary", "日记");
        genres.put("story", "故事");
        genres.put("report", "报告");
        genres.put("email", "邮件");
        GENRES = Collections.unmodifiableMap(genres);
    }

    public EvaluationCriteria normalize(String grade, String level, String genre, String topic) {
        return new EvaluationCriteria(normalizeGrade(grade), normalizeLevel(level),
                genre == null ? null : normalizeGenre(genre),
                topic == null ? null : topic.trim().toLowerCase(Locale.ROOT));
    }

    public GradeTier normalizeGrade(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_GRADE;
        }
        try {
            return GradeTier.fromValue(raw);
        } catch (IllegalArgumentException e) {
            String lower = raw.trim().toLowerCase(Locale.ROOT);
            for (GradeTier tier : GradeTier.values()) {
                if (tier.getLocalName().contains(lower) || tier.getValue().contains(lower)) {
                    return tier;
                }
            }
            logger.warn("Unrecognised grade '{}', using {}", raw, DEFAULT_GRADE.getValue());
            return DEFAULT_GRADE;
        }
    }

    public ProficiencyLevel normalizeLevel(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_LEVEL;
        }
        try {
            return ProficiencyLevel.fromValue(raw);
        } catch (IllegalArgumentException e) {
            logger.warn("Unrecognised level '{}', using {}", raw, DEFAULT_LEVEL.getValue());
            return DEFAULT_LEVEL;
        }
    }

    /**
     * Canonical genre tag for an English tag, a Chinese name or a fragment of either.
     * Anything else is returned trimmed and lower-cased.
     */
    public String normalizeGenre(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (GENRES.containsKey(lower)) {
            return lower;
        }
        for (Map.Entry<String, String> genre : GENRES.entrySet()) {
            if (genre.getValue().equals(trimmed)) {
                return genre.getKey();
            }
        }
        for (Map.Entry<String, String> genre : GENRES.entrySet()) {
            if (genre.getKey().contains(lower) || genre.getValue().contains(trimmed)) {
                return genre.getKey();
            }
        }
        return lower;
    }
}
