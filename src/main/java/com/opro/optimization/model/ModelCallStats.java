package com.opro.optimization.model;

public record ModelCallStats(RequestStats proposal, RequestStats grading) {

    public record RequestStats(long requests, long promptTokens, long completionTokens) {
    }

    public long totalRequests() {
        return proposal.requests() + grading.requests();
    }
}
