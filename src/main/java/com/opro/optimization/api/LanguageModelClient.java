package com.opro.optimization.api;

import com.opro.optimization.model.ModelCompletion;

/**
 * Handle to a chat model. Passed explicitly to the proposer and the grader so that each call can
 * name its own model and temperature, and so tests can substitute a fake.
 */
public interface LanguageModelClient {

    /**
     * Sends a single user message and returns the raw reply.
     *
     * @param prompt The full text sent to the model.
     * @param model The model identifier.
     * @param temperature The sampling temperature.
     * @return The reply text (possibly empty) together with token usage.
     */
    ModelCompletion complete(String prompt, String model, double temperature);
}
