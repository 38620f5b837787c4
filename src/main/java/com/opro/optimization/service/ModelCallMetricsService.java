package com.opro.optimization.service;

import com.opro.optimization.model.ModelCallStats;
import com.opro.optimization.model.ModelCompletion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

import static com.opro.optimization.OptimizationConstants.PURPOSE_PROPOSAL;

/**
 * Process-wide request and token counters. Side channel only; nothing in the optimization loop reads it.
 */
@Service
@Slf4j
public class ModelCallMetricsService {

    private final Counters proposal = new Counters();
    private final Counters grading = new Counters();

    public void recordRequest(String purpose, ModelCompletion completion) {
        Counters counters = PURPOSE_PROPOSAL.equals(purpose) ? proposal : grading;
        long count = counters.requests.incrementAndGet();
        counters.promptTokens.addAndGet(completion.promptTokens());
        counters.completionTokens.addAndGet(completion.completionTokens());
        if (PURPOSE_PROPOSAL.equals(purpose)) {
            log.info("LLM request #{} completed (purpose={}). Prompt tokens={}, candidate tokens={}.",
                    count, purpose, completion.promptTokens(), completion.completionTokens());
        } else if (log.isDebugEnabled()) {
            log.debug("LLM request #{} completed (purpose={}). Prompt tokens={}, candidate tokens={}.",
                    count, purpose, completion.promptTokens(), completion.completionTokens());
        }
    }

    public ModelCallStats read() {
        return new ModelCallStats(proposal.snapshot(), grading.snapshot());
    }

    public void reset() {
        proposal.clear();
        grading.clear();
        log.info("LLM request statistics reset.");
    }

    public void logSummary() {
        ModelCallStats stats = read();
        log.info("LLM stats: totalRequests={}, proposal={}, grading={}.",
                stats.totalRequests(), stats.proposal(), stats.grading());
    }

    private static final class Counters {
        private final AtomicLong requests = new AtomicLong();
        private final AtomicLong promptTokens = new AtomicLong();
        private final AtomicLong completionTokens = new AtomicLong();

        ModelCallStats.RequestStats snapshot() {
            return new ModelCallStats.RequestStats(requests.get(), promptTokens.get(), completionTokens.get());
        }

        void clear() {
            requests.set(0);
            promptTokens.set(0);
            completionTokens.set(0);
        }
    }
}
