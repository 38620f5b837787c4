package com.opro.optimization.api;

import com.opro.optimization.error.GenerationFailure;

import java.util.List;

/**
 * Asks the optimizer model for new candidate instructions.
 */
public interface PromptProposer {

    /**
     * Proposes up to {@code k} candidates for the given meta-prompt.
     *
     * @param metaPrompt The rendered search prompt.
     * @param k The number of candidates requested, between 1 and 16.
     * @param temperature Optimizer sampling temperature.
     * @param model Optimizer model identifier.
     * @return Between 1 and {@code k} trimmed candidate texts.
     * @throws GenerationFailure when every attempt failed.
     */
    List<String> propose(String metaPrompt, int k, double temperature, String model);
}
