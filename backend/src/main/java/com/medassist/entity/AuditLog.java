package com.medassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "system_logs", indexes = {
    @Index(name = "idx_logs_patient", columnList = "patient_id"),
    @Index(name = "idx_logs_entity", columnList = "entity_type, entity_id"),
    @Index(name = "idx_logs_time", columnList = "operation_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "log_id")
    private Long id;

    @Column(name = "operation_time", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, length = 40)
    private AuditAction action;

    @Column(name = "operation_user", length = 50)
    private String operationUser;

    @Column(name = "entity_type", length = 50)
    private String entityType;

    @Column(name = "entity_id", length = 100)
    private String entityId;

    @Column(name = "patient_id", length = 200)
    private String patientId;

    @Column(name = "operation_details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AuditStatus status;

    public enum AuditAction {
        // Reasoning
        PROFILE_ASSEMBLED,
        RISK_ASSESSED,
        RECOMMENDATION_COMPOSED,
        CONTRAINDICATION_BLOCKED,
        GUIDELINE_QUERY,
        TERM_LOOKUP,

        // Plan lifecycle
        PLAN_TRANSITION,

        // Sources and corpus
        SOURCE_DEGRADED,
        CORPUS_RELOADED,
        CORPUS_RELOAD_FAILED
    }

    public enum AuditStatus {
        SUCCESS,
        WARNING,
        FAILURE
    }
}
