package com.opro.optimization.error;

/**
 * Base type for failures surfaced by the optimization loop. None of them leave a session half-updated.
 */
public abstract class OptimizationFailure extends RuntimeException {

    protected OptimizationFailure(String message) {
        super(message);
    }

    protected OptimizationFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
