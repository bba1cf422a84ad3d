package com.edurange.ctf.modules.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Activity log for lifecycle transitions.
 *
 * <p>Appends are best effort: a failure to store or publish an event is logged
 * and never reaches the caller. Each row commits in its own transaction, so an
 * event survives a later rollback of the caller and a failed insert never marks
 * the caller's transaction rollback-only.
 */
@Slf4j
@Service
public class AuditLogService {

    private final AuditEventRepository auditEventRepository;
    private final AuditEventPublisher auditEventPublisher;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public AuditLogService(AuditEventRepository auditEventRepository,
            AuditEventPublisher auditEventPublisher,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.auditEventRepository = auditEventRepository;
        this.auditEventPublisher = auditEventPublisher;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void append(AuditEventType eventType, UUID actorId, String subjectId, UUID groupId,
            Map<String, Object> metadata) {
        AuditEvent saved;
        try {
            saved = requiresNew.execute(status -> auditEventRepository.save(AuditEvent.builder()
                    .eventType(eventType)
                    .severity(eventType.severity())
                    .actorId(actorId)
                    .subjectId(subjectId)
                    .groupId(groupId)
                    .metadata(metadata == null ? Map.of() : metadata)
                    .timestamp(clock.instant())
                    .build()));
        } catch (Exception e) {
            log.error("Failed to append audit event type={}, actorId={}, subjectId={}: {}",
                    eventType, actorId, subjectId, e.getMessage(), e);
            return;
        }

        try {
            auditEventPublisher.publish(AuditEventDto.from(saved));
        } catch (Exception e) {
            log.error("Failed to publish audit event id={}, type={}: {}",
                    saved.getId(), eventType, e.getMessage());
        }
    }

    public void append(AuditEventType eventType, UUID actorId, String subjectId, UUID groupId) {
        append(eventType, actorId, subjectId, groupId, Map.of());
    }

    @Transactional(readOnly = true)
    public Page<AuditEventDto> listForGroup(UUID groupId, Pageable pageable) {
        return auditEventRepository.findByGroupIdOrderByTimestampDesc(groupId, pageable)
                .map(AuditEventDto::from);
    }
}
