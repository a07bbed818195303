package com.medassist.service;

import com.medassist.entity.AuditLog;
import com.medassist.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Audit trail of reasoning actions, written to {@code system_logs}.
 * Writes are asynchronous; a failed write is logged and never reaches the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    @Value("${medassist.audit.operator:reasoning-core}")
    private String operator;

    @Async
    public void log(AuditLog.AuditAction action, String entityType, String entityId,
                    String patientId, String details, AuditLog.AuditStatus status, Long executionTimeMs) {
        try {
            AuditLog entry = AuditLog.builder()
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .patientId(patientId)
                .details(details)
                .status(status)
                .executionTimeMs(executionTimeMs)
                .operationUser(operator)
                .timestamp(Instant.now(clock))
                .build();

            auditLogRepository.save(entry);

        } catch (Exception e) {
            log.error("Failed to create audit log: {}", e.getMessage(), e);
        }
    }

    public void logRecommendation(String patientId, String recommendationId, String details, long executionTimeMs) {
        log(AuditLog.AuditAction.RECOMMENDATION_COMPOSED, "Recommendation", recommendationId, patientId,
            details, AuditLog.AuditStatus.SUCCESS, executionTimeMs);
    }

    public void logContraindication(String patientId, String recommendationId, String details) {
        log(AuditLog.AuditAction.CONTRAINDICATION_BLOCKED, "Recommendation", recommendationId, patientId,
            details, AuditLog.AuditStatus.WARNING, null);
    }

    public void logSourceDegraded(String patientId, String sourceName, String reason) {
        log(AuditLog.AuditAction.SOURCE_DEGRADED, "Source", sourceName, patientId,
            reason, AuditLog.AuditStatus.WARNING, null);
    }

    public void logPlanTransition(String patientId, String recommendationId, String transition) {
        log(AuditLog.AuditAction.PLAN_TRANSITION, "Recommendation", recommendationId, patientId,
            transition, AuditLog.AuditStatus.SUCCESS, null);
    }

    public void logCorpusReload(long version, int ruleCount, long executionTimeMs) {
        log(AuditLog.AuditAction.CORPUS_RELOADED, "GuidelineCorpus", String.valueOf(version), null,
            "Loaded " + ruleCount + " rules", AuditLog.AuditStatus.SUCCESS, executionTimeMs);
    }

    public void logCorpusReloadFailure(long keptVersion, String reason) {
        log(AuditLog.AuditAction.CORPUS_RELOAD_FAILED, "GuidelineCorpus", String.valueOf(keptVersion), null,
            reason, AuditLog.AuditStatus.FAILURE, null);
    }
}
