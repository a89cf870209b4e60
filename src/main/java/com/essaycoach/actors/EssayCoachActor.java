package com.essaycoach.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.essaycoach.models.GradingOutcome;
import com.essaycoach.models.PromptSelection;
import com.essaycoach.models.RetrievalRequest;
import com.essaycoach.workflow.WorkflowCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Actor front for the workflow coordinator. Selection and grading run off the actor's thread
 * and their results come back through {@code pipeToSelf}, so the actor keeps serving
 * messages while embedding and judgment calls are in flight.
 */
public class EssayCoachActor extends AbstractBehavior<CoachMessages.Command> {
    private static final Logger logger = LoggerFactory.getLogger(EssayCoachActor.class);

    private final WorkflowCoordinator coordinator;
    private final Executor blockingExecutor;

    // Completion of an asynchronous step, delivered back to this actor
    private static final class SelectionDone implements CoachMessages.Command {
        final PromptSelection selection;
        final ActorRef<CoachMessages.PromptSelected> replyTo;

        SelectionDone(PromptSelection selection, ActorRef<CoachMessages.PromptSelected> replyTo) {
            this.selection = selection;
            this.replyTo = replyTo;
        }
    }

    private static final class GradingDone implements CoachMessages.Command {
        final GradingOutcome outcome;
        final ActorRef<CoachMessages.EssayGraded> replyTo;

        GradingDone(GradingOutcome outcome, ActorRef<CoachMessages.EssayGraded> replyTo) {
            this.outcome = outcome;
            this.replyTo = replyTo;
        }
    }

    private EssayCoachActor(ActorContext<CoachMessages.Command> context, WorkflowCoordinator coordinator) {
        super(context);
        this.coordinator = coordinator;
        this.blockingExecutor = context.getSystem().dispatchers().lookup(DispatcherSelector.blocking());
        logger.info("EssayCoachActor started");
    }

    public static Behavior<CoachMessages.Command> create(WorkflowCoordinator coordinator) {
        return Behaviors.setup(context -> new EssayCoachActor(context, coordinator));
    }

    @Override
    public Receive<CoachMessages.Command> createReceive() {
        return newReceiveBuilder()
                .onMessage(CoachMessages.SelectPrompt.class, this::onSelectPrompt)
                .onMessage(CoachMessages.GradeEssay.class, this::onGradeEssay)
                .onMessage(SelectionDone.class, this::onSelectionDone)
                .onMessage(GradingDone.class, this::onGradingDone)
                .build();
    }

    private Behavior<CoachMessages.Command> onSelectPrompt(CoachMessages.SelectPrompt msg) {
        if (msg.getCriteria() == null) {
            msg.getReplyTo().tell(new CoachMessages.PromptSelected(PromptSelection.noMatch()));
            return this;
        }
        RetrievalRequest request = new RetrievalRequest(msg.getCriteria(), msg.getQuery());
        CompletionStage<PromptSelection> selection =
                CompletableFuture.supplyAsync(() -> coordinator.selectPrompt(request), blockingExecutor);
        getContext().pipeToSelf(selection, (result, failure) -> {
            if (failure != null) {
                logger.error("❌ Prompt selection failed for {}: {}", msg.getCriteria(), failure.getMessage());
                return new SelectionDone(PromptSelection.noMatch(), msg.getReplyTo());
            }
            return new SelectionDone(result, msg.getReplyTo());
        });
        return this;
    }

    private Behavior<CoachMessages.Command> onGradeEssay(CoachMessages.GradeEssay msg) {
        logger.info("📨 Grading request for prompt {}", msg.getPrompt() == null ? "<none>" : msg.getPrompt().getId());
        CompletionStage<GradingOutcome> outcome = msg.getWeights() == null
                ? coordinator.gradeEssayAsync(msg.getEssay(), msg.getPrompt())
                : coordinator.gradeEssayAsync(msg.getEssay(), msg.getPrompt(), msg.getWeights());
        getContext().pipeToSelf(outcome, (result, failure) -> {
            if (failure != null) {
                logger.error("❌ Grading failed: {}", failure.getMessage());
                return new GradingDone(GradingOutcome.failed(failure.getMessage()), msg.getReplyTo());
            }
            return new GradingDone(result, msg.getReplyTo());
        });
        return this;
    }

    private Behavior<CoachMessages.Command> onSelectionDone(SelectionDone msg) {
        msg.replyTo.tell(new CoachMessages.PromptSelected(msg.selection));
        return this;
    }

    private Behavior<CoachMessages.Command> onGradingDone(GradingDone msg) {
        logger.info("✅ Grading finished: {}", msg.outcome.getKind());
        msg.replyTo.tell(new CoachMessages.EssayGraded(msg.outcome));
        return this;
    }
}
