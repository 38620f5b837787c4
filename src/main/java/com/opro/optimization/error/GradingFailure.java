package com.opro.optimization.error;

/**
 * A single grading call failed. Raised inside the grader's retry boundary and absorbed there.
 */
public class GradingFailure extends OptimizationFailure {

    public GradingFailure(String message) {
        super(message);
    }

    public GradingFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
