package com.opro.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * A whole session (steps and prompts included) stored as one JSON document.
 */
@Entity
@Table(name = "opro_session")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OproSessionRecord {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "current_step", nullable = false)
    private int currentStep;

    @Column(name = "document", nullable = false, columnDefinition = "TEXT")
    private String document;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
