package com.edurange.ctf.modules.accesscode;

import com.edurange.ctf.modules.accesscode.dto.AccessCodeDto;
import com.edurange.ctf.modules.accesscode.dto.IssueAccessCodeRequest;
import com.edurange.ctf.modules.accesscode.dto.RedeemCodeRequest;
import com.edurange.ctf.modules.accesscode.dto.RedemptionResult;
import com.edurange.ctf.modules.lifecycle.LifecycleCoordinator;
import com.edurange.ctf.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/competitions")
@RequiredArgsConstructor
@Tag(name = "Access Codes", description = "Issue, list, revoke and redeem competition access codes")
public class AccessCodeController {

    private final LifecycleCoordinator coordinator;
    private final SecurityUtils securityUtils;

    @PostMapping("/join")
    @Operation(summary = "Join a competition with an access code")
    public ResponseEntity<RedemptionResult> join(@Valid @RequestBody RedeemCodeRequest request) {
        return ResponseEntity.ok(coordinator.enroll(securityUtils.getCurrentUser(), request.getCode()));
    }

    @PostMapping("/{groupId}/access-codes")
    @Operation(summary = "Generate an access code (instructor)")
    public ResponseEntity<AccessCodeDto> issue(@PathVariable UUID groupId,
            @Valid @RequestBody IssueAccessCodeRequest request) {
        AccessCodeDto code = coordinator.issueAccessCode(securityUtils.getCurrentUser(), groupId,
                request.getTtlMinutes(), request.getGrantRole(), request.getMaxUses());
        return ResponseEntity.status(HttpStatus.CREATED).body(code);
    }

    @GetMapping("/{groupId}/access-codes")
    @Operation(summary = "List a competition's access codes (instructor)")
    public ResponseEntity<List<AccessCodeDto>> list(@PathVariable UUID groupId) {
        return ResponseEntity.ok(coordinator.listAccessCodes(securityUtils.getCurrentUser(), groupId));
    }

    @DeleteMapping("/{groupId}/access-codes/{codeId}")
    @Operation(summary = "Revoke an access code (instructor)")
    public ResponseEntity<Map<String, String>> revoke(@PathVariable UUID groupId, @PathVariable UUID codeId) {
        coordinator.revokeAccessCode(securityUtils.getCurrentUser(), groupId, codeId);
        return ResponseEntity.ok(Map.of("message", "Access code deleted successfully"));
    }
}
