package com.opro.optimization.model;

import org.springframework.lang.Nullable;

public record PromptScoreResult(
        String promptId,
        boolean scored,
        @Nullable Double score,
        @Nullable ScoreReport report,
        @Nullable String error,
        boolean discarded
) {
    public static PromptScoreResult scored(String promptId, double score, ScoreReport report) {
        return new PromptScoreResult(promptId, true, score, report, null, false);
    }

    public static PromptScoreResult failed(String promptId, String error, boolean discarded) {
        return new PromptScoreResult(promptId, false, null, null, error, discarded);
    }

    public static PromptScoreResult discarded(String promptId, ScoreReport report) {
        return new PromptScoreResult(promptId, false, null, report, null, true);
    }
}
