package com.edurange.ctf.modules.instance;

import com.edurange.ctf.modules.instance.dto.ChallengeInstanceDto;
import com.edurange.ctf.modules.instance.dto.StartInstanceRequest;
import com.edurange.ctf.modules.lifecycle.LifecycleCoordinator;
import com.edurange.ctf.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/instances")
@RequiredArgsConstructor
@Tag(name = "Challenge Instances", description = "Start, inspect and stop challenge environments")
public class InstanceController {

    private final LifecycleCoordinator coordinator;
    private final SecurityUtils securityUtils;

    @PostMapping
    @Operation(summary = "Start a challenge (returns the live instance if one exists)")
    public ResponseEntity<ChallengeInstanceDto> start(@Valid @RequestBody StartInstanceRequest request) {
        return ResponseEntity.ok(coordinator.startChallenge(securityUtils.getCurrentUser(),
                request.getCompetitionId(), request.getChallengeId()));
    }

    @GetMapping
    @Operation(summary = "My challenge instances, newest first")
    public ResponseEntity<List<ChallengeInstanceDto>> list() {
        return ResponseEntity.ok(coordinator.listInstances(securityUtils.getCurrentUser()));
    }

    @GetMapping("/{deploymentName}")
    @Operation(summary = "Instance status, refreshed from the orchestration backend")
    public ResponseEntity<ChallengeInstanceDto> get(@PathVariable String deploymentName) {
        return ResponseEntity.ok(coordinator.getInstance(securityUtils.getCurrentUser(), deploymentName));
    }

    @PostMapping("/{deploymentName}/stop")
    @Operation(summary = "Stop a challenge instance (owner or instructor)")
    public ResponseEntity<ChallengeInstanceDto> stop(@PathVariable String deploymentName) {
        return ResponseEntity.ok(coordinator.stopChallenge(securityUtils.getCurrentUser(), deploymentName));
    }
}
