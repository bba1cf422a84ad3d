package com.edurange.ctf.modules.accesscode.dto;

import com.edurange.ctf.modules.competition.MembershipRole;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class RedemptionResult {
    private UUID accessCodeId;
    private UUID groupId;
    private String groupName;
    private MembershipRole grantRole;
    /** True when this user had already redeemed the code. */
    private boolean repeat;
}
