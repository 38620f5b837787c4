package com.opro.optimization.error;

public class NotFoundFailure extends OptimizationFailure {

    private NotFoundFailure(String message) {
        super(message);
    }

    public static NotFoundFailure session(String sessionId) {
        return new NotFoundFailure("Session " + sessionId + " not found");
    }

    public static NotFoundFailure prompt(String sessionId, String promptId) {
        return new NotFoundFailure("Prompt " + promptId + " not found in session " + sessionId);
    }

    public static NotFoundFailure run(String runId) {
        return new NotFoundFailure("Run " + runId + " not found");
    }
}
