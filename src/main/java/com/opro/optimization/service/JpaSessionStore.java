package com.opro.optimization.service;

import com.opro.entity.OproSessionRecord;
import com.opro.optimization.api.SessionStore;
import com.opro.optimization.model.Session;
import com.opro.repository.OproSessionRecordRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(prefix = "opro.store", name = "type", havingValue = "jpa")
public class JpaSessionStore implements SessionStore {

    private final OproSessionRecordRepository repository;
    private final JsonProcessingService jsonProcessingService;

    public JpaSessionStore(OproSessionRecordRepository repository, JsonProcessingService jsonProcessingService) {
        this.repository = repository;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> get(String id) {
        return repository.findById(id).map(this::toSession);
    }

    @Override
    @Transactional
    public void put(Session session) {
        OproSessionRecord record = repository.findById(session.getId())
                .orElseGet(() -> OproSessionRecord.builder().id(session.getId()).build());
        record.setName(session.getName());
        record.setCurrentStep(session.getCurrentStep());
        record.setDocument(jsonProcessingService.toJson(session));
        repository.save(record);
    }

    @Override
    @Transactional
    public void delete(String id) {
        repository.deleteById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Session> listAll() {
        return repository.findAllByOrderByCreatedAtDesc().stream()
                .map(this::toSession)
                .toList();
    }

    private Session toSession(OproSessionRecord record) {
        return jsonProcessingService.fromJson(record.getDocument(), Session.class);
    }
}
