package com.opro.api;

import com.opro.optimization.model.Prompt;
import com.opro.optimization.model.Session;

import java.time.Instant;

public record SessionSummary(
        String id,
        String name,
        int currentStep,
        int promptCount,
        Double bestScore,
        Instant createdAt,
        Instant updatedAt
) {
    public static SessionSummary from(Session session) {
        int promptCount = session.getSteps().stream().mapToInt(step -> step.getPrompts().size()).sum();
        Double best = session.getScoredPrompts().stream()
                .map(Prompt::getScore)
                .max(Double::compare)
                .orElse(null);
        return new SessionSummary(session.getId(), session.getName(), session.getCurrentStep(), promptCount, best,
                session.getCreatedAt(), session.getUpdatedAt());
    }
}
