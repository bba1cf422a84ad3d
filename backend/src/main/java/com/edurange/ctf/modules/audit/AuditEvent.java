package com.edurange.ctf.modules.audit;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One recorded lifecycle transition. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "audit_events")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 50)
    private AuditEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditEventType.Severity severity;

    @Column(name = "actor_id")
    private UUID actorId;

    @Column(name = "subject_id", length = 255)
    private String subjectId;

    @Column(name = "group_id")
    private UUID groupId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata;

    @Column(name = "occurred_at", nullable = false)
    private Instant timestamp;
}
