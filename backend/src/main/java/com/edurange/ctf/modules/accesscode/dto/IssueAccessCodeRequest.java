package com.edurange.ctf.modules.accesscode.dto;

import com.edurange.ctf.modules.competition.MembershipRole;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class IssueAccessCodeRequest {

    /** Defaults to the configured TTL when absent. */
    @Min(1)
    @Max(60 * 24 * 365)
    private Integer ttlMinutes;

    private MembershipRole grantRole = MembershipRole.MEMBER;

    /** Null for unlimited redemptions, 1 for a single-use code. */
    @Min(1)
    private Integer maxUses;
}
