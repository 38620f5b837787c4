package com.opro.optimization.model;

import java.time.Instant;

/**
 * A prompt flattened together with the step it belongs to.
 */
public record PromptView(
        int stepNumber,
        String id,
        String text,
        PromptState state,
        Double score,
        Instant createdAt
) {
    public static PromptView of(Step step, Prompt prompt) {
        return new PromptView(step.getStepNumber(), prompt.getId(), prompt.getText(), prompt.getState(),
                prompt.getScore(), prompt.getCreatedAt());
    }
}
