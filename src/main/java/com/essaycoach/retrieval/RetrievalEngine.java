package com.essaycoach.retrieval;

import com.essaycoach.corpus.PromptCorpus;
import com.essaycoach.corpus.SearchResult;
import com.essaycoach.errors.EmbeddingException;
import com.essaycoach.models.EvaluationCriteria;
import com.essaycoach.models.PromptRecord;
import com.essaycoach.models.PromptSelection;
import com.essaycoach.models.RetrievalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Picks one prompt from the corpus for a request. An exhausted search is reported as
 * {@link PromptSelection#noMatch()}, never as an exception.
 */
public class RetrievalEngine {
    private static final Logger logger = LoggerFactory.getLogger(RetrievalEngine.class);

    public static final int DEFAULT_RECOMMENDATIONS = 5;
    static final int MIN_RECOMMENDATIONS = 3;

    private final PromptCorpus corpus;

    public RetrievalEngine(PromptCorpus corpus) {
        this.corpus = Objects.requireNonNull(corpus, "corpus");
    }

    public PromptSelection select(EvaluationCriteria criteria) {
        return select(RetrievalRequest.of(criteria));
    }

    /**
     * Best prompt for the request. Without free text the ranking uses a query synthesised
     * from the criteria; equal similarities go to the lowest id.
     */
    public PromptSelection select(RetrievalRequest request) {
        EvaluationCriteria criteria = request.criteria();
        String query = request.query().orElseGet(() -> syntheticQuery(criteria));

        SearchResult result;
        try {
            result = corpus.search(criteria, query, 1);
        } catch (EmbeddingException e) {
            logger.warn("⚠️ Could not embed query '{}', ranking by id instead: {}", query, e.getMessage());
            result = corpus.search(criteria, null, 1);
        }

        if (result.isEmpty()) {
            logger.info("🔎 No prompt available for {}", criteria);
            return PromptSelection.noMatch();
        }
        var best = result.best().orElseThrow();
        logger.info("🎯 Selected prompt {} '{}' ({}, similarity {})", best.prompt().getId(),
                best.prompt().getTitle(), result.relaxation(), String.format("%.3f", best.similarity()));
        return PromptSelection.matched(best.prompt(), best.similarity(), result.relaxation());
    }

    /**
     * Query text built from the criteria: {@code "<genre> essay <topic> <level> english"},
     * omitting the parts that are absent.
     */
    public static String syntheticQuery(EvaluationCriteria criteria) {
        StringJoiner query = new StringJoiner(" ");
        criteria.getGenre().ifPresent(query::add);
        query.add("essay");
        criteria.getTopic().ifPresent(query::add);
        query.add(criteria.getLevel().getValue());
        query.add("english");
        return query.toString();
    }

    public List<PromptRecord> recommend(EvaluationCriteria criteria, Collection<String> recentTopics) {
        return recommend(criteria, recentTopics, DEFAULT_RECOMMENDATIONS);
    }

    /**
     * Practice prompts for a learner: same grade tier and level, skipping recently practised topics.
     * When fewer than three are found the list is topped up with same-level prompts from any tier.
     */
    public List<PromptRecord> recommend(EvaluationCriteria criteria, Collection<String> recentTopics, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Set<String> recent = new HashSet<>();
        if (recentTopics != null) {
            for (String topic : recentTopics) {
                if (topic != null) {
                    recent.add(topic.trim().toLowerCase(Locale.ROOT));
                }
            }
        }

        List<PromptRecord> all = corpus.getAll();
        List<PromptRecord> recommendations = new ArrayList<>();
        for (PromptRecord prompt : all) {
            if (recommendations.size() >= limit) break;
            if (prompt.getGrade() == criteria.getGrade()
                    && prompt.getLevel() == criteria.getLevel()
                    && !recent.contains(prompt.getTopic().toLowerCase(Locale.ROOT))) {
                recommendations.add(prompt);
            }
        }

        if (recommendations.size() < MIN_RECOMMENDATIONS) {
            for (PromptRecord prompt : all) {
                if (recommendations.size() >= limit) break;
                if (prompt.getLevel() == criteria.getLevel() && !recommendations.contains(prompt)) {
                    recommendations.add(prompt);
                }
            }
        }
        logger.debug("Recommended {} prompt(s) for {}", recommendations.size(), criteria);
        return List.copyOf(recommendations);
    }
}
