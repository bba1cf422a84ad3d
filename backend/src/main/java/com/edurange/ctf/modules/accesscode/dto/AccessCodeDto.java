package com.edurange.ctf.modules.accesscode.dto;

import com.edurange.ctf.modules.accesscode.AccessCode;
import com.edurange.ctf.modules.competition.MembershipRole;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class AccessCodeDto {
    private UUID id;
    private String code;
    private UUID groupId;
    private UUID createdBy;
    private Instant expiresAt;
    private MembershipRole grantRole;
    private Integer maxUses;
    private Integer usedCount;
    private boolean expired;
    private Instant createdAt;

    public static AccessCodeDto from(AccessCode code, Instant now) {
        return AccessCodeDto.builder()
                .id(code.getId())
                .code(code.getCode())
                .groupId(code.getGroup().getId())
                .createdBy(code.getCreatedBy())
                .expiresAt(code.getExpiresAt())
                .grantRole(code.getGrantRole())
                .maxUses(code.getMaxUses())
                .usedCount(code.getUsedCount())
                .expired(code.isExpiredAt(now))
                .createdAt(code.getCreatedAt())
                .build();
    }
}
