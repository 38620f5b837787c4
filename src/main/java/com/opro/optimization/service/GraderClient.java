package com.opro.optimization.service;

import com.opro.optimization.api.LanguageModelClient;
import com.opro.optimization.api.PromptGrader;
import com.opro.optimization.error.GradingFailure;
import com.opro.optimization.model.GradeOutcome;
import com.opro.optimization.model.ModelCompletion;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import static com.opro.optimization.OptimizationConstants.GRADING_OUTPUT_INSTRUCTION;
import static com.opro.optimization.OptimizationConstants.PURPOSE_GRADING;

@Service
@Slf4j
public class GraderClient implements PromptGrader {

    private final LanguageModelClient languageModel;
    private final JsonProcessingService jsonProcessingService;
    private final ModelCallMetricsService metricsService;
    private final Retry retry;

    public GraderClient(LanguageModelClient languageModel,
                        JsonProcessingService jsonProcessingService,
                        ModelCallMetricsService metricsService,
                        @Qualifier("graderRetry") Retry retry) {
        this.languageModel = languageModel;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
        this.retry = retry;
    }

    @Override
    public GradeOutcome grade(String fullPrompt, double temperature, String model) {
        String request = fullPrompt + GRADING_OUTPUT_INSTRUCTION;
        try {
            return retry.executeSupplier(() -> attemptGrade(request, temperature, model));
        } catch (RuntimeException ex) {
            log.debug("Grading call failed after {} attempts: {}", retry.getRetryConfig().getMaxAttempts(),
                    ex.getMessage());
            return new GradeOutcome.Failed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private GradeOutcome attemptGrade(String request, double temperature, String model) {
        ModelCompletion completion = languageModel.complete(request, model, temperature);
        metricsService.recordRequest(PURPOSE_GRADING, completion);
        GradeOutcome outcome = jsonProcessingService.parseGrade(completion.text());
        if (outcome.isRetryable()) {
            throw new GradingFailure(outcome instanceof GradeOutcome.ParseError parseError
                    ? "Unparseable grading reply: " + parseError.raw()
                    : "Empty response from LLM");
        }
        return outcome;
    }
}
