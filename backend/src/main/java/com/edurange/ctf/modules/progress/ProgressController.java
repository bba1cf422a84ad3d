package com.edurange.ctf.modules.progress;

import com.edurange.ctf.modules.lifecycle.LifecycleCoordinator;
import com.edurange.ctf.modules.progress.dto.SubmitAnswerRequest;
import com.edurange.ctf.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/competitions/{groupId}")
@RequiredArgsConstructor
@Tag(name = "Progress", description = "Answers, completions, points and resets")
public class ProgressController {

    private final LifecycleCoordinator coordinator;
    private final SecurityUtils securityUtils;

    @PostMapping("/challenges/{challengeId}/questions/{questionId}/answer")
    @Operation(summary = "Submit an answer to a challenge question")
    public ResponseEntity<ProgressService.AnswerResult> submitAnswer(@PathVariable UUID groupId,
            @PathVariable UUID challengeId, @PathVariable UUID questionId,
            @Valid @RequestBody SubmitAnswerRequest request) {
        return ResponseEntity.ok(coordinator.submitAnswer(securityUtils.getCurrentUser(), groupId, challengeId,
                questionId, request.getAnswer()));
    }

    @PostMapping("/users/{userId}/challenges/{challengeId}/complete")
    @Operation(summary = "Credit a challenge completion to a user (instructor)")
    public ResponseEntity<ProgressService.CompletionResult> recordCompletion(@PathVariable UUID groupId,
            @PathVariable UUID userId, @PathVariable UUID challengeId) {
        return ResponseEntity.ok(coordinator.recordCompletion(securityUtils.getCurrentUser(), groupId, userId,
                challengeId));
    }

    @PostMapping("/users/{userId}/reset")
    @Operation(summary = "Reset a user's progress in the competition (instructor)")
    public ResponseEntity<Map<String, Object>> resetProgress(@PathVariable UUID groupId, @PathVariable UUID userId) {
        ProgressService.ResetSummary summary = coordinator.resetProgress(securityUtils.getCurrentUser(), groupId,
                userId);
        return ResponseEntity.ok(Map.of(
                "message", "User progress reset successfully",
                "questionCompletionsRemoved", summary.getQuestionCompletionsRemoved(),
                "challengeCompletionsRemoved", summary.getChallengeCompletionsRemoved(),
                "previousPoints", summary.getPreviousPoints()));
    }

    @GetMapping("/leaderboard")
    @Operation(summary = "Competition leaderboard")
    public ResponseEntity<List<ProgressService.LeaderboardEntry>> leaderboard(@PathVariable UUID groupId) {
        return ResponseEntity.ok(coordinator.leaderboard(securityUtils.getCurrentUser(), groupId));
    }
}
