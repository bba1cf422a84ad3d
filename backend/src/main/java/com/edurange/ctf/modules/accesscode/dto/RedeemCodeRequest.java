package com.edurange.ctf.modules.accesscode.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RedeemCodeRequest {

    @NotBlank(message = "Access code is required")
    @Size(max = 32)
    private String code;
}
