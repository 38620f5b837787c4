package com.opro.optimization;

import com.opro.config.OproProperties;
import com.opro.optimization.error.GradingFailure;
import com.opro.optimization.error.NotFoundFailure;
import com.opro.optimization.model.BatchScoreResult;
import com.opro.optimization.model.GenerationResult;
import com.opro.optimization.model.Session;
import com.opro.optimization.service.ModelCallMetricsService;
import com.opro.stream.OptimizationStreamService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static com.opro.optimization.OptimizationConstants.*;

/**
 * Fully automatic mode: repeats generate, score until nothing is pending, and advance for a number of
 * steps. Progress goes to the run's event stream. A run stops when it is cancelled, when the operator
 * switches to another session, or at the first failure.
 */
@Service
@Slf4j
public class AutoRunService {

    public static final int MAX_STEPS = 100;

    private final OptimizationService optimizationService;
    private final OptimizationStreamService streamService;
    private final ModelCallMetricsService metricsService;
    private final ExecutorService autoRunExecutor;
    private final Duration stepDelay;
    private final Map<String, Future<?>> activeRuns = new ConcurrentHashMap<>();

    public AutoRunService(OptimizationService optimizationService,
                          OptimizationStreamService streamService,
                          ModelCallMetricsService metricsService,
                          @Qualifier("autoRunExecutor") ExecutorService autoRunExecutor,
                          OproProperties properties) {
        this.optimizationService = optimizationService;
        this.streamService = streamService;
        this.metricsService = metricsService;
        this.autoRunExecutor = autoRunExecutor;
        this.stepDelay = properties.getAutoRun().getStepDelay();
    }

    /**
     * Makes the session active and starts the loop in the background.
     *
     * @return The run id to subscribe to and to cancel with.
     */
    public String start(String sessionId, int steps) {
        if (steps < 1 || steps > MAX_STEPS) {
            throw new IllegalArgumentException("steps must be between 1 and " + MAX_STEPS);
        }
        optimizationService.activateSession(sessionId);
        String runId = streamService.openRun(sessionId);
        log.info("Starting automatic run {} for session {} over {} steps.", runId, sessionId, steps);
        Future<?> future = autoRunExecutor.submit(() -> execute(runId, sessionId, steps));
        activeRuns.put(runId, future);
        if (future.isDone()) {
            activeRuns.remove(runId);
        }
        return runId;
    }

    public void cancel(String runId) {
        if (!streamService.cancel(runId)) {
            throw NotFoundFailure.run(runId);
        }
        Future<?> future = activeRuns.get(runId);
        if (future != null) {
            future.cancel(true);
        }
        log.info("Cancellation requested for run {}.", runId);
    }

    void execute(String runId, String sessionId, int steps) {
        try {
            String status = loop(runId, sessionId, steps);
            log.info("Automatic run {} for session {} finished: {}.", runId, sessionId, status);
            streamService.emitRunComplete(runId, status);
        } catch (RuntimeException ex) {
            log.warn("Automatic run {} for session {} failed: {}", runId, sessionId, ex.getMessage());
            streamService.emitError(runId, ex.getMessage());
            streamService.emitRunComplete(runId, RUN_STATUS_FAILED);
        } finally {
            activeRuns.remove(runId);
            metricsService.logSummary();
        }
    }

    private String loop(String runId, String sessionId, int steps) {
        for (int completed = 0; completed < steps; completed++) {
            if (stopped(runId, sessionId)) {
                return RUN_STATUS_CANCELLED;
            }
            Session session = optimizationService.getSession(sessionId);
            streamService.emitStatus(runId, "Step " + session.getCurrentStep() + " (" + (completed + 1) + " of " + steps + ")");

            if (session.getActiveStep().getPrompts().isEmpty()) {
                GenerationResult generated = optimizationService.generate(sessionId);
                if (generated.discarded()) {
                    return RUN_STATUS_CANCELLED;
                }
                streamService.emitStepGenerated(runId, generated);
                if (!pause(runId, sessionId)) {
                    return RUN_STATUS_CANCELLED;
                }
            }

            while (!optimizationService.getSession(sessionId).getActiveStep().pendingPrompts().isEmpty()) {
                if (stopped(runId, sessionId)) {
                    return RUN_STATUS_CANCELLED;
                }
                BatchScoreResult batch = optimizationService.scoreBatch(sessionId, null);
                streamService.emitBatchScored(runId, batch);
                if (batch.anyDiscarded()) {
                    return RUN_STATUS_CANCELLED;
                }
                if (batch.scoredCount() == 0 && batch.failedCount() > 0) {
                    throw new GradingFailure("No prompt in the batch could be scored");
                }
                if (!pause(runId, sessionId)) {
                    return RUN_STATUS_CANCELLED;
                }
            }

            if (stopped(runId, sessionId)) {
                return RUN_STATUS_CANCELLED;
            }
            Session advanced = optimizationService.advance(sessionId);
            streamService.emitStepAdvanced(runId, advanced);
            if (completed + 1 < steps && !pause(runId, sessionId)) {
                return RUN_STATUS_CANCELLED;
            }
        }
        return RUN_STATUS_COMPLETED;
    }

    private boolean stopped(String runId, String sessionId) {
        if (streamService.isCancelled(runId) || Thread.currentThread().isInterrupted()) {
            return true;
        }
        if (!optimizationService.isActive(sessionId)) {
            streamService.emitStatus(runId, "Session " + sessionId + " is no longer active; stopping.");
            return true;
        }
        return false;
    }

    private boolean pause(String runId, String sessionId) {
        if (!stepDelay.isZero() && !stepDelay.isNegative()) {
            try {
                Thread.sleep(stepDelay.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return !stopped(runId, sessionId);
    }

    @PreDestroy
    public void shutdown() {
        activeRuns.keySet().forEach(streamService::cancel);
        activeRuns.values().forEach(future -> future.cancel(true));
    }
}
