package com.opro.optimization.model;

import java.util.List;

public record BatchScoreResult(
        String sessionId,
        int stepNumber,
        List<PromptScoreResult> results
) {
    public long scoredCount() {
        return results.stream().filter(PromptScoreResult::scored).count();
    }

    public long failedCount() {
        return results.stream().filter(result -> !result.scored() && !result.discarded()).count();
    }

    public boolean anyDiscarded() {
        return results.stream().anyMatch(PromptScoreResult::discarded);
    }
}
