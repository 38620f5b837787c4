package com.opro.api;

public record CancelRunResponse(
        String runId,
        String status,
        String message
) {
    public static CancelRunResponse accepted(String runId) {
        return new CancelRunResponse(runId, "success", "Run cancellation requested.");
    }
}
