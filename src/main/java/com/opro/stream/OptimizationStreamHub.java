package com.opro.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static com.opro.optimization.OptimizationConstants.*;

/**
 * Fans run events out to WebSocket listeners and keeps a backlog so late listeners can catch up.
 */
@Component
public class OptimizationStreamHub {
    private static final Logger log = LoggerFactory.getLogger(OptimizationStreamHub.class);
    private static final int MAX_BACKLOG = 500;
    private static final Duration FINISHED_RUN_TTL = Duration.ofMinutes(30);
    static final String RUN_ID_ATTRIBUTE = "runId";

    private final ObjectMapper objectMapper;
    private final Map<String, StreamRun> runs = new ConcurrentHashMap<>();

    public OptimizationStreamHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String openRun(String sessionId) {
        evictFinishedRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new StreamRun(runId, sessionId));
        return runId;
    }

    public void attach(String runId, WebSocketSession socket, long afterEventId) throws IOException {
        StreamRun run = runs.get(runId);
        if (run == null) {
            socket.close();
            return;
        }
        run.listeners().put(socket.getId(), socket);
        socket.getAttributes().put(RUN_ID_ATTRIBUTE, runId);
        for (StreamEvent event : run.eventsAfter(afterEventId)) {
            deliver(socket, event);
        }
    }

    public void detach(WebSocketSession socket) {
        Object runId = socket.getAttributes().get(RUN_ID_ATTRIBUTE);
        if (runId == null) {
            return;
        }
        StreamRun run = runs.get(runId.toString());
        if (run != null) {
            run.listeners().remove(socket.getId());
        }
    }

    /**
     * Publishes an event. Once a run is cancelled only terminal events still go out.
     */
    public void publish(String runId, String type, Object data) {
        StreamRun run = runs.get(runId);
        if (run == null || run.finished()) {
            return;
        }
        if (run.cancelled() && !isTerminal(type)) {
            return;
        }
        broadcast(run, run.append(type, data, MAX_BACKLOG));
    }

    public void finish(String runId, String status) {
        StreamRun run = runs.get(runId);
        if (run == null || run.finished()) {
            return;
        }
        broadcast(run, run.append(EVENT_RUN_COMPLETE, Map.of("status", status, "sessionId", run.sessionId()), MAX_BACKLOG));
        run.finish(status);
    }

    public boolean cancel(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        if (run.cancelled() || run.finished()) {
            return true;
        }
        run.requestCancel();
        broadcast(run, run.append(EVENT_RUN_CANCEL, Map.of("sessionId", run.sessionId()), MAX_BACKLOG));
        return true;
    }

    public boolean isCancelled(String runId) {
        StreamRun run = runs.get(runId);
        return run != null && run.cancelled();
    }

    public Optional<RunStatus> status(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return Optional.empty();
        }
        String state = run.finished() ? run.status() : run.cancelled() ? "CANCELLING" : "RUNNING";
        return Optional.of(new RunStatus(run.runId(), run.sessionId(), state, run.lastUpdated()));
    }

    public record RunStatus(String runId, String sessionId, String status, Instant lastUpdated) {
    }

    private static boolean isTerminal(String type) {
        return EVENT_RUN_CANCEL.equals(type) || EVENT_RUN_COMPLETE.equals(type) || EVENT_ERROR.equals(type);
    }

    private void broadcast(StreamRun run, StreamEvent event) {
        run.listeners().values().forEach(socket -> deliver(socket, event));
    }

    private void deliver(WebSocketSession socket, StreamEvent event) {
        if (!socket.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (socket) {
                socket.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Could not deliver event {} of run {}: {}", event.id(), event.runId(), ex.getMessage());
        }
    }

    private void evictFinishedRuns() {
        Instant cutoff = Instant.now().minus(FINISHED_RUN_TTL);
        runs.values().removeIf(run -> run.finished()
                && run.listeners().isEmpty()
                && run.lastUpdated().isBefore(cutoff));
    }
}
