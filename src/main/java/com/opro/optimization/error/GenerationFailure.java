package com.opro.optimization.error;

/**
 * The proposer exhausted its attempts or never returned a usable candidate list.
 */
public class GenerationFailure extends OptimizationFailure {

    public GenerationFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
