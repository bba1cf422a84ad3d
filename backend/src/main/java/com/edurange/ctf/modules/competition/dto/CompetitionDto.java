package com.edurange.ctf.modules.competition.dto;

import com.edurange.ctf.modules.competition.CompetitionGroup;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class CompetitionDto {
    private UUID id;
    private String name;
    private String description;
    private Instant startDate;
    private Instant endDate;
    private CompetitionGroup.Phase phase;
    private UUID createdBy;
    private Instant createdAt;
    private List<UUID> instructorIds;
    private List<ChallengeEntry> challenges;

    @Data
    @Builder
    public static class ChallengeEntry {
        private UUID groupChallengeId;
        private UUID challengeId;
        private String name;
        private String challengeType;
        private Integer points;
    }
}
