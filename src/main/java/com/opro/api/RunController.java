package com.opro.api;

import com.opro.optimization.AutoRunService;
import com.opro.optimization.error.NotFoundFailure;
import com.opro.stream.OptimizationStreamHub.RunStatus;
import com.opro.stream.OptimizationStreamService;
import com.opro.stream.OptimizationStreamWebSocketHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api")
public class RunController {

    private final AutoRunService autoRunService;
    private final OptimizationStreamService streamService;

    public RunController(AutoRunService autoRunService, OptimizationStreamService streamService) {
        this.autoRunService = autoRunService;
        this.streamService = streamService;
    }

    @PostMapping("/sessions/{sessionId}/auto-run")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public AutoRunResponse start(@PathVariable String sessionId, @Valid @RequestBody SessionRequests.AutoRun request) {
        String runId = autoRunService.start(sessionId, request.steps());
        return new AutoRunResponse(runId, sessionId, request.steps(), OptimizationStreamWebSocketHandler.subscriptionPath(runId), Instant.now());
    }

    @GetMapping("/runs/{runId}")
    public RunStatus status(@PathVariable String runId) {
        return streamService.status(runId).orElseThrow(() -> NotFoundFailure.run(runId));
    }

    @PostMapping("/runs/{runId}/cancel")
    public CancelRunResponse cancel(@PathVariable String runId) {
        autoRunService.cancel(runId);
        return CancelRunResponse.accepted(runId);
    }

    public record AutoRunResponse(String runId, String sessionId, int steps, String streamPath, Instant startedAt) {}
}
