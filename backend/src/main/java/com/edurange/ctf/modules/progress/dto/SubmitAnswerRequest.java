package com.edurange.ctf.modules.progress.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SubmitAnswerRequest {

    @NotNull(message = "Answer is required")
    @Size(max = 1000)
    private String answer;
}
