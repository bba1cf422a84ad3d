package com.edurange.ctf.modules.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.util.UUID;

/**
 * Append-only access to the audit table: no update or delete methods are exposed.
 */
public interface AuditEventRepository extends Repository<AuditEvent, Long> {

    AuditEvent save(AuditEvent event);

    Page<AuditEvent> findByGroupIdOrderByTimestampDesc(UUID groupId, Pageable pageable);
}
