package com.opro.optimization.model;

import java.util.List;

/**
 * Result of a Generate call. {@code discarded} is set when the operator switched sessions while the
 * proposer was running; the candidates were then not recorded.
 */
public record GenerationResult(
        Session session,
        List<Prompt> prompts,
        boolean discarded
) {
}
