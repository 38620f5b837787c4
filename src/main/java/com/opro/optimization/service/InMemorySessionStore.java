package com.opro.optimization.service;

import com.opro.optimization.api.SessionStore;
import com.opro.optimization.model.Session;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps JSON snapshots, so callers never share a mutable {@link Session} with the store.
 */
@Component
@ConditionalOnProperty(prefix = "opro.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private final JsonProcessingService jsonProcessingService;
    private final Map<String, String> documents = new ConcurrentHashMap<>();

    public InMemorySessionStore(JsonProcessingService jsonProcessingService) {
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    public Optional<Session> get(String id) {
        String document = documents.get(id);
        return document == null ? Optional.empty() : Optional.of(jsonProcessingService.fromJson(document, Session.class));
    }

    @Override
    public void put(Session session) {
        documents.put(session.getId(), jsonProcessingService.toJson(session));
    }

    @Override
    public void delete(String id) {
        documents.remove(id);
    }

    @Override
    public List<Session> listAll() {
        return documents.values().stream()
                .map(document -> jsonProcessingService.fromJson(document, Session.class))
                .toList();
    }
}
