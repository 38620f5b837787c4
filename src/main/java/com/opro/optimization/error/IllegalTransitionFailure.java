package com.opro.optimization.error;

/**
 * An operation's precondition on prompt or step state did not hold. Nothing was mutated.
 */
public class IllegalTransitionFailure extends OptimizationFailure {

    public IllegalTransitionFailure(String message) {
        super(message);
    }
}
