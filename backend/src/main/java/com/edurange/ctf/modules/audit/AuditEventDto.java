package com.edurange.ctf.modules.audit;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
public class AuditEventDto {
    private Long id;
    private AuditEventType eventType;
    private AuditEventType.Severity severity;
    private UUID actorId;
    private String subjectId;
    private UUID groupId;
    private Map<String, Object> metadata;
    private Instant timestamp;

    public static AuditEventDto from(AuditEvent event) {
        return AuditEventDto.builder()
                .id(event.getId())
                .eventType(event.getEventType())
                .severity(event.getSeverity())
                .actorId(event.getActorId())
                .subjectId(event.getSubjectId())
                .groupId(event.getGroupId())
                .metadata(event.getMetadata())
                .timestamp(event.getTimestamp())
                .build();
    }
}
