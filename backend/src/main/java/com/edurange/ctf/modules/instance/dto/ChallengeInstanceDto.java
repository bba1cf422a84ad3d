package com.edurange.ctf.modules.instance.dto;

import com.edurange.ctf.modules.instance.ChallengeInstance;
import com.edurange.ctf.modules.instance.InstanceStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class ChallengeInstanceDto {
    private UUID id;
    private UUID userId;
    private UUID challengeId;
    private UUID competitionId;
    private String challengeType;
    private String deploymentName;
    private String challengeUrl;
    private String terminalUrl;
    private InstanceStatus status;
    private InstanceStatus.Source statusSource;
    private String backendStatus;
    private String failureReason;
    private Instant lastReconciledAt;
    private Instant createdAt;
    private Instant terminatedAt;

    public static ChallengeInstanceDto from(ChallengeInstance instance) {
        return ChallengeInstanceDto.builder()
                .id(instance.getId())
                .userId(instance.getUserId())
                .challengeId(instance.getChallengeId())
                .competitionId(instance.getCompetitionId())
                .challengeType(instance.getChallengeType().wireName())
                .deploymentName(instance.getDeploymentName())
                .challengeUrl(instance.getChallengeUrl())
                .terminalUrl(instance.getTerminalUrl())
                .status(instance.getStatus())
                .statusSource(instance.getStatusSource())
                .backendStatus(instance.getBackendStatus())
                .failureReason(instance.getFailureReason())
                .lastReconciledAt(instance.getLastReconciledAt())
                .createdAt(instance.getCreatedAt())
                .terminatedAt(instance.getTerminatedAt())
                .build();
    }
}
