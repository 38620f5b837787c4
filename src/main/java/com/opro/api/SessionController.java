package com.opro.api;

import com.opro.optimization.OptimizationService;
import com.opro.optimization.model.BatchScoreResult;
import com.opro.optimization.model.GenerationResult;
import com.opro.optimization.model.OproConfig;
import com.opro.optimization.model.PromptScoreResult;
import com.opro.optimization.model.PromptView;
import com.opro.optimization.model.ScoreReport;
import com.opro.optimization.model.Session;
import com.opro.optimization.service.OproConfigValidator;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final OptimizationService optimizationService;
    private final OproConfigValidator configValidator;

    public SessionController(OptimizationService optimizationService, OproConfigValidator configValidator) {
        this.optimizationService = optimizationService;
        this.configValidator = configValidator;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Session create(@Valid @RequestBody SessionRequests.CreateSession request) {
        OproConfig config = configValidator.resolve(request.k(), request.topX(), request.optimizerModel(),
                request.optimizerTemperature(), request.scorerModel(), request.scorerTemperature());
        return optimizationService.createSession(request.name(), config);
    }

    @GetMapping
    public List<SessionSummary> list() {
        return optimizationService.listSessions().stream().map(SessionSummary::from).toList();
    }

    @GetMapping("/{sessionId}")
    public Session get(@PathVariable String sessionId) {
        return optimizationService.getSession(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String sessionId) {
        optimizationService.deleteSession(sessionId);
    }

    @PostMapping("/{sessionId}/activate")
    public Session activate(@PathVariable String sessionId) {
        return optimizationService.activateSession(sessionId);
    }

    @GetMapping("/{sessionId}/meta-prompt")
    public MetaPromptResponse metaPrompt(@PathVariable String sessionId) {
        return new MetaPromptResponse(sessionId, optimizationService.previewMetaPrompt(sessionId));
    }

    @PostMapping("/{sessionId}/generate")
    public GenerationResult generate(@PathVariable String sessionId) {
        return optimizationService.generate(sessionId);
    }

    @PostMapping("/{sessionId}/prompts/{promptId}/score")
    public PromptScoreResult scoreOne(@PathVariable String sessionId, @PathVariable String promptId) {
        return optimizationService.scoreOne(sessionId, promptId);
    }

    @PostMapping("/{sessionId}/score-batch")
    public BatchScoreResult scoreBatch(@PathVariable String sessionId,
                                       @Valid @RequestBody(required = false) SessionRequests.ScoreBatch request) {
        return optimizationService.scoreBatch(sessionId, request == null ? null : request.batchSize());
    }

    @PostMapping("/{sessionId}/advance")
    public Session advance(@PathVariable String sessionId) {
        return optimizationService.advance(sessionId);
    }

    @PostMapping("/{sessionId}/custom-score")
    public ScoreReport customScore(@PathVariable String sessionId,
                                   @Valid @RequestBody SessionRequests.CustomScore request) {
        return optimizationService.customScore(sessionId, request.text());
    }

    @GetMapping("/{sessionId}/prompts")
    public List<PromptView> prompts(@PathVariable String sessionId) {
        return optimizationService.listPrompts(sessionId);
    }

    public record MetaPromptResponse(String sessionId, String metaPrompt) {}
}
