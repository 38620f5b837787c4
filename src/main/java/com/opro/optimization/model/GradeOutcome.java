package com.opro.optimization.model;

/**
 * Result of one per-question grading call. {@link Failed} is the sentinel produced once the
 * retry budget is spent; only {@link Answered} can ever count as correct.
 */
public interface GradeOutcome {

    record Answered(double answer) implements GradeOutcome {
    }

    record ParseError(String raw) implements GradeOutcome {
    }

    record EmptyResponse() implements GradeOutcome {
    }

    record Failed(String reason) implements GradeOutcome {
    }

    default boolean matches(double goldAnswer) {
        return this instanceof Answered answered && answered.answer() == goldAnswer;
    }

    default boolean isRetryable() {
        return this instanceof ParseError || this instanceof EmptyResponse;
    }
}
