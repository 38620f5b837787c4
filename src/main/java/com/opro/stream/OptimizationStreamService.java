package com.opro.stream;

import com.opro.optimization.model.BatchScoreResult;
import com.opro.optimization.model.GenerationResult;
import com.opro.optimization.model.PromptScoreResult;
import com.opro.optimization.model.Session;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.opro.optimization.OptimizationConstants.*;

/**
 * Typed event publishing for automatic runs.
 */
@Component
public class OptimizationStreamService {

    private final OptimizationStreamHub hub;

    public OptimizationStreamService(OptimizationStreamHub hub) {
        this.hub = hub;
    }

    public String openRun(String sessionId) {
        return hub.openRun(sessionId);
    }

    public boolean isCancelled(String runId) {
        return hub.isCancelled(runId);
    }

    public boolean cancel(String runId) {
        return hub.cancel(runId);
    }

    public Optional<OptimizationStreamHub.RunStatus> status(String runId) {
        return hub.status(runId);
    }

    public void emitStatus(String runId, String message) {
        hub.publish(runId, EVENT_STATUS, Map.of("message", message));
    }

    public void emitStepGenerated(String runId, GenerationResult result) {
        List<Map<String, Object>> prompts = result.prompts().stream()
                .map(prompt -> Map.<String, Object>of("id", prompt.getId(), "text", prompt.getText()))
                .toList();
        hub.publish(runId, EVENT_STEP_GENERATED, Map.of(
                "sessionId", result.session().getId(),
                "stepNumber", result.session().getCurrentStep(),
                "prompts", prompts
        ));
    }

    public void emitBatchScored(String runId, BatchScoreResult batch) {
        for (PromptScoreResult result : batch.results()) {
            if (result.discarded()) {
                continue;
            }
            Map<String, Object> payload = new HashMap<>();
            payload.put("sessionId", batch.sessionId());
            payload.put("stepNumber", batch.stepNumber());
            payload.put("promptId", result.promptId());
            if (result.scored()) {
                payload.put("score", result.score());
                payload.put("failedCalls", result.report().failed());
                hub.publish(runId, EVENT_PROMPT_SCORED, payload);
            } else {
                payload.put("error", String.valueOf(result.error()));
                hub.publish(runId, EVENT_PROMPT_FAILED, payload);
            }
        }
    }

    public void emitStepAdvanced(String runId, Session session) {
        hub.publish(runId, EVENT_STEP_ADVANCED, Map.of(
                "sessionId", session.getId(),
                "currentStep", session.getCurrentStep()
        ));
    }

    public void emitError(String runId, String message) {
        hub.publish(runId, EVENT_ERROR, Map.of("message", message));
    }

    public void emitRunComplete(String runId, String status) {
        hub.finish(runId, status);
    }
}
