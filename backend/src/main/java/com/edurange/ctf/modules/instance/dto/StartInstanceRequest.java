package com.edurange.ctf.modules.instance.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class StartInstanceRequest {

    @NotNull(message = "competitionId is required")
    private UUID competitionId;

    @NotNull(message = "challengeId is required")
    private UUID challengeId;
}
