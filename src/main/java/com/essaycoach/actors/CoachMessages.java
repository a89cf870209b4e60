package com.essaycoach.actors;

import akka.actor.typed.ActorRef;
import com.essaycoach.models.EvaluationCriteria;
import com.essaycoach.models.GradingOutcome;
import com.essaycoach.models.PromptRecord;
import com.essaycoach.models.PromptSelection;
import com.essaycoach.models.RubricWeights;

/**
 * Message types for the essay coach actor
 */
public class CoachMessages {

    // Base message interface
    public interface Command {
        // Marker interface for everything the coach actor accepts
    }

    // Prompt selection
    public static class SelectPrompt implements Command {
        private final EvaluationCriteria criteria;
        private final String query;
        private final ActorRef<PromptSelected> replyTo;

        public SelectPrompt(EvaluationCriteria criteria, String query, ActorRef<PromptSelected> replyTo) {
            this.criteria = criteria;
            this.query = query;
            this.replyTo = replyTo;
        }

        public SelectPrompt(EvaluationCriteria criteria, ActorRef<PromptSelected> replyTo) {
            this(criteria, null, replyTo);
        }

        public EvaluationCriteria getCriteria() { return criteria; }
        public String getQuery() { return query; }
        public ActorRef<PromptSelected> getReplyTo() { return replyTo; }
    }

    public static class PromptSelected {
        private final PromptSelection selection;

        public PromptSelected(PromptSelection selection) {
            this.selection = selection;
        }

        public PromptSelection getSelection() { return selection; }
    }

    // Grading
    public static class GradeEssay implements Command {
        private final String essay;
        private final PromptRecord prompt;
        private final RubricWeights weights;
        private final ActorRef<EssayGraded> replyTo;

        /**
         * @param weights rubric to apply, or null for the configured weights with the prompt's word range
         */
        public GradeEssay(String essay, PromptRecord prompt, RubricWeights weights, ActorRef<EssayGraded> replyTo) {
            this.essay = essay;
            this.prompt = prompt;
            this.weights = weights;
            this.replyTo = replyTo;
        }

        public GradeEssay(String essay, PromptRecord prompt, ActorRef<EssayGraded> replyTo) {
            this(essay, prompt, null, replyTo);
        }

        public String getEssay() { return essay; }
        public PromptRecord getPrompt() { return prompt; }
        public RubricWeights getWeights() { return weights; }
        public ActorRef<EssayGraded> getReplyTo() { return replyTo; }
    }

    public static class EssayGraded {
        private final GradingOutcome outcome;

        public EssayGraded(GradingOutcome outcome) {
            this.outcome = outcome;
        }

        public GradingOutcome getOutcome() { return outcome; }
    }
}
