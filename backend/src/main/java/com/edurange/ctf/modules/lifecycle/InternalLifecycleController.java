package com.edurange.ctf.modules.lifecycle;

import com.edurange.ctf.modules.instance.dto.ChallengeInstanceDto;
import com.edurange.ctf.modules.instance.dto.InstanceFailureReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Triggers for sweeps and monitoring callbacks. Called by operators, cron jobs
 * and the health monitor with an ADMIN token.
 */
@RestController
@RequestMapping("/api/internal")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Internal", description = "Admin triggers for lifecycle sweeps")
public class InternalLifecycleController {

    private final LifecycleCoordinator coordinator;

    @PostMapping("/access-codes/sweep")
    @Operation(summary = "Mark expired access codes (idempotent)")
    public ResponseEntity<Map<String, Integer>> sweepAccessCodes() {
        return ResponseEntity.ok(Map.of("expired", coordinator.expireAccessCodes()));
    }

    @PostMapping("/competitions/terminate-ended")
    @Operation(summary = "Stop live instances of competitions past their end date")
    public ResponseEntity<Map<String, Integer>> terminateEnded() {
        return ResponseEntity.ok(Map.of("stopped", coordinator.terminateEndedCompetitions()));
    }

    @PostMapping("/instances/{deploymentName}/failure")
    @Operation(summary = "Report a failed health check for an instance")
    public ResponseEntity<ChallengeInstanceDto> reportFailure(@PathVariable String deploymentName,
            @Valid @RequestBody InstanceFailureReport report) {
        return ResponseEntity.ok(coordinator.reportInstanceFailure(deploymentName, report.getReason()));
    }
}
