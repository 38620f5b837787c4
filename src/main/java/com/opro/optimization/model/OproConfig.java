package com.opro.optimization.model;

/**
 * Per-session optimization settings, fixed at session creation.
 *
 * @param k                    candidates generated per step (1-16)
 * @param topX                 best distinct candidates shown to the proposer
 * @param optimizerModel       proposer model identifier
 * @param optimizerTemperature proposer sampling temperature
 * @param scorerModel          grader model identifier
 * @param scorerTemperature    grader sampling temperature
 */
public record OproConfig(
        int k,
        int topX,
        String optimizerModel,
        double optimizerTemperature,
        String scorerModel,
        double scorerTemperature
) {
    public static final int MIN_K = 1;
    public static final int MAX_K = 16;
}
