package com.opro.api;

import com.opro.config.OproProperties;
import com.opro.optimization.api.PromptProposer;
import com.opro.optimization.model.ModelCallStats;
import com.opro.optimization.model.QuestionAnswer;
import com.opro.optimization.model.ScoreReport;
import com.opro.optimization.service.ModelCallMetricsService;
import com.opro.optimization.service.ScorerEngine;
import jakarta.validation.Valid;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Session-less access to the proposer and the scorer, plus model-call statistics.
 */
@RestController
@RequestMapping("/api")
public class OptimizerController {

    private final PromptProposer proposer;
    private final ScorerEngine scorer;
    private final ModelCallMetricsService metricsService;
    private final OproProperties properties;

    public OptimizerController(PromptProposer proposer,
                               ScorerEngine scorer,
                               ModelCallMetricsService metricsService,
                               OproProperties properties) {
        this.proposer = proposer;
        this.scorer = scorer;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    @PostMapping("/generate")
    public GenerateResponse generate(@Valid @RequestBody OptimizerRequests.Generate request) {
        OproProperties.SessionDefaults defaults = properties.getDefaults();
        int k = request.k() != null ? request.k() : defaults.getK();
        double temperature = request.temperature() != null ? request.temperature() : defaults.getOptimizerTemperature();
        String model = StringUtils.hasText(request.model()) ? request.model() : defaults.getOptimizerModel();
        List<String> prompts = proposer.propose(request.metaPrompt(), k, temperature, model);
        return new GenerateResponse(true, prompts, prompts.size());
    }

    @PostMapping("/score")
    public ScoreResponse score(@Valid @RequestBody OptimizerRequests.Score request) {
        OproProperties.SessionDefaults defaults = properties.getDefaults();
        double temperature = request.temperature() != null ? request.temperature() : defaults.getScorerTemperature();
        String model = StringUtils.hasText(request.model()) ? request.model() : defaults.getScorerModel();
        List<QuestionAnswer> questions = request.questions().stream()
                .map(question -> new QuestionAnswer(question.question(), question.goldAnswer()))
                .toList();
        ScoreReport report = scorer.score(request.prompt(), questions, temperature, model);
        return new ScoreResponse(true, report.accuracy(), questions.size(), request.prompt(), report.failed());
    }

    @GetMapping("/stats")
    public ModelCallStats stats() {
        return metricsService.read();
    }

    @PostMapping("/stats/reset")
    public ModelCallStats resetStats() {
        metricsService.reset();
        return metricsService.read();
    }

    public record GenerateResponse(boolean success, List<String> prompts, int count) {}

    public record ScoreResponse(boolean success, double accuracy, int totalQuestions, String prompt, int failedCalls) {}
}
