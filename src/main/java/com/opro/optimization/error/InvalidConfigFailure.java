package com.opro.optimization.error;

import java.util.List;

public class InvalidConfigFailure extends OptimizationFailure {

    private final List<String> violations;

    public InvalidConfigFailure(List<String> violations) {
        super("Invalid optimization config: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
