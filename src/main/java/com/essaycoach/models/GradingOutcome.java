package com.essaycoach.models;

import java.util.Objects;
import java.util.Optional;

/**
 * What a grading call hands back to its caller: a result, a rejection of the input,
 * or a classified internal failure.
 */
public final class GradingOutcome {

    public enum Kind {
        GRADED,
        REJECTED,
        FAILED
    }

    private final Kind kind;
    private final GradingResult result;
    private final String reason;

    private GradingOutcome(Kind kind, GradingResult result, String reason) {
        this.kind = kind;
        this.result = result;
        this.reason = reason;
    }

    public static GradingOutcome graded(GradingResult result) {
        return new GradingOutcome(Kind.GRADED, Objects.requireNonNull(result, "result"), null);
    }

    public static GradingOutcome rejected(String reason) {
        return new GradingOutcome(Kind.REJECTED, null, reason);
    }

    public static GradingOutcome failed(String reason) {
        return new GradingOutcome(Kind.FAILED, null, reason);
    }

    public Kind getKind() { return kind; }

    public boolean isGraded() {
        return kind == Kind.GRADED;
    }

    public Optional<GradingResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return kind == Kind.GRADED
                ? "GradingOutcome{GRADED, " + result + "}"
                : "GradingOutcome{" + kind + ", reason='" + reason + "'}";
    }
}
