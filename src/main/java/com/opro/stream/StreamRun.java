package com.opro.stream;

import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One automatic optimization run: its bounded event backlog and the sockets listening to it.
 */
class StreamRun {
    private final String runId;
    private final String sessionId;
    private final Deque<StreamEvent> backlog = new ArrayDeque<>();
    private final Map<String, WebSocketSession> listeners = new ConcurrentHashMap<>();
    private long lastEventId;
    private volatile String status;
    private volatile boolean cancelled;
    private volatile Instant lastUpdated = Instant.now();

    StreamRun(String runId, String sessionId) {
        this.runId = runId;
        this.sessionId = sessionId;
    }

    String runId() {
        return runId;
    }

    String sessionId() {
        return sessionId;
    }

    Map<String, WebSocketSession> listeners() {
        return listeners;
    }

    synchronized StreamEvent append(String type, Object data, int maxBacklog) {
        StreamEvent event = new StreamEvent(++lastEventId, runId, Instant.now(), type, data);
        backlog.addLast(event);
        while (backlog.size() > maxBacklog) {
            backlog.removeFirst();
        }
        lastUpdated = event.timestamp();
        return event;
    }

    synchronized List<StreamEvent> eventsAfter(long eventId) {
        return backlog.stream()
                .filter(event -> event.id() > eventId)
                .toList();
    }

    boolean finished() {
        return status != null;
    }

    String status() {
        return status;
    }

    boolean cancelled() {
        return cancelled;
    }

    void finish(String finalStatus) {
        status = finalStatus;
        lastUpdated = Instant.now();
    }

    void requestCancel() {
        cancelled = true;
        lastUpdated = Instant.now();
    }

    Instant lastUpdated() {
        return lastUpdated;
    }
}
