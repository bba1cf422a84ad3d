package com.edurange.ctf.modules.competition;

import com.edurange.ctf.modules.competition.dto.CompetitionDto;
import com.edurange.ctf.modules.competition.dto.CreateCompetitionRequest;
import com.edurange.ctf.modules.lifecycle.LifecycleCoordinator;
import com.edurange.ctf.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/competitions")
@RequiredArgsConstructor
@Tag(name = "Competitions", description = "Competition groups and membership")
public class CompetitionController {

    private final LifecycleCoordinator coordinator;
    private final SecurityUtils securityUtils;

    @PostMapping
    @PreAuthorize("hasAnyRole('INSTRUCTOR', 'ADMIN')")
    @Operation(summary = "Create a competition (creator becomes instructor)")
    public ResponseEntity<CompetitionDto> createCompetition(@Valid @RequestBody CreateCompetitionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(coordinator.createCompetition(securityUtils.getCurrentUser(), request));
    }

    @GetMapping("/mine")
    @Operation(summary = "My competitions split into active, upcoming and completed")
    public ResponseEntity<MembershipService.MyCompetitions> myCompetitions() {
        return ResponseEntity.ok(coordinator.listMyCompetitions(securityUtils.getCurrentUser()));
    }

    @GetMapping("/{groupId}")
    @Operation(summary = "Competition details (participants only)")
    public ResponseEntity<CompetitionDto> getCompetition(@PathVariable UUID groupId) {
        return ResponseEntity.ok(coordinator.getCompetition(securityUtils.getCurrentUser(), groupId));
    }

    @DeleteMapping("/{groupId}")
    @Operation(summary = "Delete a competition, stopping its live instances (instructor)")
    public ResponseEntity<Map<String, String>> deleteCompetition(@PathVariable UUID groupId) {
        coordinator.deleteCompetition(securityUtils.getCurrentUser(), groupId);
        return ResponseEntity.ok(Map.of("message", "Competition deleted successfully"));
    }

    @DeleteMapping("/{groupId}/members/{userId}")
    @Operation(summary = "Leave a competition, or remove a member (instructor)")
    public ResponseEntity<Map<String, String>> removeMember(@PathVariable UUID groupId, @PathVariable UUID userId) {
        coordinator.removeMember(securityUtils.getCurrentUser(), groupId, userId);
        return ResponseEntity.ok(Map.of("message", "Member removed successfully"));
    }
}
