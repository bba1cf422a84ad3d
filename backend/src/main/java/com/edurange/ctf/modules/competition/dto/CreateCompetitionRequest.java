package com.edurange.ctf.modules.competition.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
public class CreateCompetitionRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200)
    private String name;

    private String description;

    @NotNull(message = "Start date is required")
    private Instant startDate;

    /** Optional; an open-ended competition never completes. */
    private Instant endDate;

    /** Additional instructors besides the creator. */
    private List<UUID> instructorIds = new ArrayList<>();

    @Valid
    private List<ChallengeAssignment> challenges = new ArrayList<>();

    @Data
    public static class ChallengeAssignment {
        @NotNull
        private UUID challengeId;

        @NotNull
        @Min(0)
        private Integer points;
    }
}
