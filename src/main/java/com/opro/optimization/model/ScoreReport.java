package com.opro.optimization.model;

/**
 * Outcome of scoring one candidate. {@code failed} counts grading calls that exhausted their retries;
 * they are included in {@code incorrect}.
 */
public record ScoreReport(
        double accuracy,
        int correct,
        int incorrect,
        int failed,
        int total
) {
    public double roundedAccuracy() {
        return Math.round(accuracy * 100) / 100.0;
    }
}
