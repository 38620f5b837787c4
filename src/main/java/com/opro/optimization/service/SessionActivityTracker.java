package com.opro.optimization.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks which session the operator is working in. Asynchronous completions carry the {@link Ticket}
 * they were started under and are dropped if the session was switched in the meantime. Switching
 * away and back again also invalidates old tickets.
 */
@Component
@Slf4j
public class SessionActivityTracker {

    public record Ticket(String sessionId, long epoch) {
    }

    private final AtomicLong epochs = new AtomicLong();
    private final AtomicReference<Ticket> active = new AtomicReference<>();

    /**
     * Makes {@code sessionId} the active session, invalidating every outstanding ticket.
     */
    public Ticket activate(String sessionId) {
        Ticket ticket = new Ticket(sessionId, epochs.incrementAndGet());
        Ticket previous = active.getAndSet(ticket);
        if (previous != null && !previous.sessionId().equals(sessionId)) {
            log.info("Switched active session {} -> {}. In-flight results for {} will be discarded.",
                    previous.sessionId(), sessionId, previous.sessionId());
        }
        return ticket;
    }

    /**
     * Returns the current ticket when {@code sessionId} is already active, otherwise switches to it.
     */
    public Ticket enter(String sessionId) {
        Ticket current = active.get();
        if (current != null && current.sessionId().equals(sessionId)) {
            return current;
        }
        return activate(sessionId);
    }

    public boolean isCurrent(Ticket ticket) {
        return ticket.equals(active.get());
    }

    public boolean isActive(String sessionId) {
        Ticket current = active.get();
        return current != null && current.sessionId().equals(sessionId);
    }

    @Nullable
    public String activeSessionId() {
        Ticket current = active.get();
        return current == null ? null : current.sessionId();
    }

    public void deactivate(String sessionId) {
        Ticket current = active.get();
        if (current != null && current.sessionId().equals(sessionId)) {
            active.compareAndSet(current, null);
        }
    }
}
