package com.opro.optimization.service;

import com.opro.optimization.api.LanguageModelClient;
import com.opro.optimization.api.PromptProposer;
import com.opro.optimization.error.GenerationFailure;
import com.opro.optimization.model.ModelCompletion;
import com.opro.optimization.model.OproConfig;
import com.opro.optimization.model.ProposalReply;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import static com.opro.optimization.OptimizationConstants.*;

@Service
@Slf4j
public class ProposerClient implements PromptProposer {

    private final LanguageModelClient languageModel;
    private final JsonProcessingService jsonProcessingService;
    private final ModelCallMetricsService metricsService;
    private final Retry retry;

    public ProposerClient(LanguageModelClient languageModel,
                          JsonProcessingService jsonProcessingService,
                          ModelCallMetricsService metricsService,
                          @Qualifier("proposerRetry") Retry retry) {
        this.languageModel = languageModel;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
        this.retry = retry;
    }

    @Override
    public List<String> propose(String metaPrompt, int k, double temperature, String model) {
        if (!StringUtils.hasText(metaPrompt)) {
            throw new IllegalArgumentException("metaPrompt must be a non-empty string");
        }
        if (k < OproConfig.MIN_K || k > OproConfig.MAX_K) {
            throw new IllegalArgumentException("k must be between " + OproConfig.MIN_K + " and " + OproConfig.MAX_K);
        }
        int maxAttempts = retry.getRetryConfig().getMaxAttempts();
        String request = metaPrompt + PROPOSAL_OUTPUT_INSTRUCTION.formatted(k);
        AtomicInteger attempt = new AtomicInteger();
        try {
            List<String> prompts = retry.executeSupplier(
                    () -> attemptProposal(request, k, temperature, model, attempt.incrementAndGet(), maxAttempts));
            log.info("Generated {} prompts (model={}, k={}).", prompts.size(), model, k);
            return prompts;
        } catch (RuntimeException ex) {
            log.warn("Optimizer gave up after {} attempts: {}", attempt.get(), ex.getMessage());
            throw new GenerationFailure("Failed to generate prompts after " + attempt.get() + " attempts: "
                    + ex.getMessage(), ex);
        }
    }

    private List<String> attemptProposal(String request, int k, double temperature, String model,
                                         int attempt, int maxAttempts) {
        log.info("Optimizer attempt {}/{} (model={}).", attempt, maxAttempts, model);
        ModelCompletion completion = languageModel.complete(request, model, temperature);
        metricsService.recordRequest(PURPOSE_PROPOSAL, completion);
        ProposalReply reply = jsonProcessingService.parseProposal(completion.text());
        if (reply instanceof ProposalReply.Texts texts) {
            List<String> cleaned = clean(texts.texts(), k);
            if (!cleaned.isEmpty()) {
                return cleaned;
            }
            throw new InvalidModelReplyException("Invalid response format: every candidate is blank");
        }
        if (reply instanceof ProposalReply.ParseError parseError) {
            throw new InvalidModelReplyException("Invalid response format: " + parseError.reason());
        }
        throw new InvalidModelReplyException("Empty response from LLM");
    }

    /**
     * Truncates to {@code k}, strips echoed start/end markers and surrounding whitespace.
     */
    static List<String> clean(List<String> texts, int k) {
        return texts.stream()
                .limit(k)
                .filter(Objects::nonNull)
                .map(text -> text.replace(START_TAG, "").replace(END_TAG, "").trim())
                .filter(StringUtils::hasText)
                .toList();
    }
}
