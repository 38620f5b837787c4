package com.opro.optimization.error;

public class IncompleteStepFailure extends OptimizationFailure {

    public IncompleteStepFailure(String sessionId, int stepNumber, long unscored, int total) {
        super(total == 0
                ? "Step " + stepNumber + " of session " + sessionId + " has no prompts"
                : "Step " + stepNumber + " of session " + sessionId + " has " + unscored + " of " + total
                        + " prompts not scored");
    }
}
