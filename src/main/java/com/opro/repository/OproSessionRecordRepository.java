package com.opro.repository;

import com.opro.entity.OproSessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Repository interface for managing {@link OproSessionRecord} entities.
 */
public interface OproSessionRecordRepository extends JpaRepository<OproSessionRecord, String> {

    List<OproSessionRecord> findAllByOrderByCreatedAtDesc();
}
