package com.edurange.ctf.modules.instance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class InstanceFailureReport {

    @NotBlank
    @Size(max = 2000)
    private String reason;
}
