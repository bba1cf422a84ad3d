package com.edurange.ctf.modules.lifecycle;

import com.edurange.ctf.exception.BusinessException;
import com.edurange.ctf.exception.CodeAlreadyConsumedException;
import com.edurange.ctf.exception.CodeExpiredException;
import com.edurange.ctf.exception.CodeNotFoundException;
import com.edurange.ctf.exception.ProvisionFailedException;
import com.edurange.ctf.exception.ResourceNotFoundException;
import com.edurange.ctf.exception.UnauthorizedAccessException;
import com.edurange.ctf.modules.accesscode.AccessCodeService;
import com.edurange.ctf.modules.accesscode.RedemptionRateLimiter;
import com.edurange.ctf.modules.accesscode.dto.AccessCodeDto;
import com.edurange.ctf.modules.accesscode.dto.RedemptionResult;
import com.edurange.ctf.modules.audit.AuditEventDto;
import com.edurange.ctf.modules.audit.AuditEventType;
import com.edurange.ctf.modules.audit.AuditLogService;
import com.edurange.ctf.modules.challenge.Challenge;
import com.edurange.ctf.modules.challenge.ChallengeRepository;
import com.edurange.ctf.modules.competition.CompetitionGroup;
import com.edurange.ctf.modules.competition.CompetitionService;
import com.edurange.ctf.modules.competition.GroupChallenge;
import com.edurange.ctf.modules.competition.MembershipRole;
import com.edurange.ctf.modules.competition.MembershipService;
import com.edurange.ctf.modules.competition.dto.CompetitionDto;
import com.edurange.ctf.modules.competition.dto.CreateCompetitionRequest;
import com.edurange.ctf.modules.instance.InstanceService;
import com.edurange.ctf.modules.instance.dto.ChallengeInstanceDto;
import com.edurange.ctf.modules.progress.ProgressService;
import com.edurange.ctf.modules.user.UserRepository;
import com.edurange.ctf.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for every lifecycle operation. Controllers hand in the acting user;
 * this class authorizes against competition membership, delegates to the
 * registry, ledger and instance services, and records one audit event for each
 * successful transition.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LifecycleCoordinator {

    private final MembershipService membershipService;
    private final CompetitionService competitionService;
    private final AccessCodeService accessCodeService;
    private final RedemptionRateLimiter redemptionRateLimiter;
    private final ProgressService progressService;
    private final InstanceService instanceService;
    private final AuditLogService auditLogService;
    private final ChallengeRepository challengeRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Value("${lifecycle.instances.max-active-per-competition:3}")
    private int maxActivePerCompetition;

    @Value("${lifecycle.instances.start-retries:2}")
    private int startRetries;

    @Value("${lifecycle.instances.start-backoff-ms:500}")
    private long startBackoffMs;

    @Value("${lifecycle.access-codes.default-ttl-minutes:10080}")
    private long defaultCodeTtlMinutes;

    // ── Access codes ─────────────────────────────────────────────────────────

    public RedemptionResult enroll(AuthenticatedUser actor, String code) {
        UUID userId = actor.getUserId();
        redemptionRateLimiter.consume(userId);

        RedemptionResult result;
        try {
            result = accessCodeService.redeem(code, userId);
        } catch (CodeNotFoundException | CodeExpiredException | CodeAlreadyConsumedException e) {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("reason", e.getClass().getSimpleName());
            metadata.put("code", code == null ? "" : code.trim());
            auditLogService.append(AuditEventType.ACCESS_CODE_INVALID, userId, userId.toString(), null, metadata);
            throw e;
        }

        auditLogService.append(AuditEventType.ACCESS_CODE_USED, userId, result.getAccessCodeId().toString(),
                result.getGroupId(), Map.of(
                        "repeat", result.isRepeat(),
                        "grantRole", result.getGrantRole().name()));
        return result;
    }

    public AccessCodeDto issueAccessCode(AuthenticatedUser actor, UUID groupId, Integer ttlMinutes,
            MembershipRole grantRole, Integer maxUses) {
        competitionService.findGroup(groupId);
        requireInstructor(actor, groupId);

        long minutes = ttlMinutes == null ? defaultCodeTtlMinutes : ttlMinutes;
        AccessCodeDto code = accessCodeService.issue(groupId, actor.getUserId(), Duration.ofMinutes(minutes),
                grantRole, maxUses);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("code", code.getCode());
        metadata.put("expiresAt", code.getExpiresAt().toString());
        metadata.put("grantRole", code.getGrantRole().name());
        metadata.put("maxUses", code.getMaxUses());
        auditLogService.append(AuditEventType.ACCESS_CODE_GENERATED, actor.getUserId(), code.getId().toString(),
                groupId, metadata);
        return code;
    }

    public List<AccessCodeDto> listAccessCodes(AuthenticatedUser actor, UUID groupId) {
        competitionService.findGroup(groupId);
        requireInstructor(actor, groupId);
        return accessCodeService.listForGroup(groupId);
    }

    public void revokeAccessCode(AuthenticatedUser actor, UUID groupId, UUID codeId) {
        competitionService.findGroup(groupId);
        requireInstructor(actor, groupId);
        AccessCodeDto revoked = accessCodeService.revoke(groupId, codeId);
        auditLogService.append(AuditEventType.ACCESS_CODE_DELETED, actor.getUserId(), codeId.toString(), groupId,
                Map.of("code", revoked.getCode(), "usedCount", revoked.getUsedCount()));
    }

    /** @return number of codes newly marked expired */
    public int expireAccessCodes() {
        return accessCodeService.sweepExpired();
    }

    // ── Competitions and membership ──────────────────────────────────────────

    public CompetitionDto createCompetition(AuthenticatedUser actor, CreateCompetitionRequest request) {
        CompetitionDto created = competitionService.createCompetition(request, actor.getUserId());
        auditLogService.append(AuditEventType.GROUP_CREATED, actor.getUserId(), created.getId().toString(),
                created.getId(), Map.of("name", created.getName(), "challenges", created.getChallenges().size()));
        return created;
    }

    public CompetitionDto getCompetition(AuthenticatedUser actor, UUID groupId) {
        CompetitionDto competition = competitionService.getCompetition(groupId);
        requireParticipant(actor, groupId);
        return competition;
    }

    public MembershipService.MyCompetitions listMyCompetitions(AuthenticatedUser actor) {
        return membershipService.listForUser(actor.getUserId());
    }

    /**
     * Stops the group's live instances, then deletes the group with everything it owns.
     */
    public void deleteCompetition(AuthenticatedUser actor, UUID groupId) {
        CompetitionGroup group = competitionService.findGroup(groupId);
        requireInstructor(actor, groupId);

        int stopped = stopLiveInstances(groupId, actor.getUserId(), "COMPETITION_DELETED");
        competitionService.deleteCompetition(groupId);
        auditLogService.append(AuditEventType.GROUP_DELETED, actor.getUserId(), groupId.toString(), groupId,
                Map.of("name", group.getName(), "instancesStopped", stopped));
    }

    public void removeMember(AuthenticatedUser actor, UUID groupId, UUID userId) {
        competitionService.findGroup(groupId);
        boolean self = actor.getUserId().equals(userId);
        if (!self) {
            requireInstructor(actor, groupId);
        }

        membershipService.removeMember(groupId, userId);
        if (self) {
            auditLogService.append(AuditEventType.GROUP_LEFT, userId, userId.toString(), groupId, Map.of());
        } else {
            auditLogService.append(AuditEventType.GROUP_MEMBER_REMOVED, actor.getUserId(), userId.toString(),
                    groupId, Map.of());
        }
    }

    /**
     * Stops live instances of every competition whose end date has passed.
     *
     * @return number of instances stopped
     */
    public int terminateEndedCompetitions() {
        int stopped = 0;
        for (CompetitionGroup group : competitionService.findEndedCompetitions()) {
            stopped += stopLiveInstances(group.getId(), null, "COMPETITION_ENDED");
        }
        if (stopped > 0) {
            log.info("Competition end: {} live instances stopped", stopped);
        }
        return stopped;
    }

    // ── Instances ────────────────────────────────────────────────────────────

    public ChallengeInstanceDto startChallenge(AuthenticatedUser actor, UUID groupId, UUID challengeId) {
        UUID userId = actor.getUserId();
        CompetitionGroup group = competitionService.findGroup(groupId);
        competitionService.findGroupChallenge(groupId, challengeId);
        Challenge challenge = challengeRepository.findById(challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge", challengeId.toString()));

        boolean privileged = actor.isAdmin() || membershipService.isInstructor(userId, groupId);
        if (!privileged && !membershipService.isParticipant(userId, groupId)) {
            throw new UnauthorizedAccessException("You are not a member of this competition");
        }
        switch (group.phaseAt(clock.instant())) {
            case COMPLETED -> throw new BusinessException("Competition has ended");
            case UPCOMING -> {
                if (!privileged) {
                    throw new BusinessException("Competition has not started yet");
                }
            }
            default -> {
            }
        }
        if (!privileged && instanceService.countLive(userId, groupId) >= maxActivePerCompetition) {
            throw new BusinessException("You already have " + maxActivePerCompetition
                    + " running challenges in this competition. Stop one before starting another.");
        }

        InstanceService.StartOutcome outcome = startWithRetry(userId, groupId, challenge);
        if (outcome.isCreated()) {
            ChallengeInstanceDto instance = outcome.getInstance();
            auditLogService.append(AuditEventType.CHALLENGE_INSTANCE_CREATED, userId, instance.getDeploymentName(),
                    groupId, Map.of(
                            "challengeId", challengeId.toString(),
                            "challengeType", instance.getChallengeType(),
                            "status", instance.getStatus().name()));
        }
        return outcome.getInstance();
    }

    public ChallengeInstanceDto stopChallenge(AuthenticatedUser actor, String deploymentName) {
        ChallengeInstanceDto current = instanceService.getInstance(deploymentName);
        requireInstanceAccess(actor, current);

        InstanceService.StopOutcome outcome = instanceService.stopInstance(deploymentName);
        if (outcome.isChanged()) {
            auditLogService.append(AuditEventType.CHALLENGE_INSTANCE_DELETED, actor.getUserId(), deploymentName,
                    current.getCompetitionId(), Map.of(
                            "ownerId", current.getUserId().toString(),
                            "backendConfirmed", outcome.isBackendConfirmed(),
                            "reason", "USER_REQUEST"));
        }
        return outcome.getInstance();
    }

    /**
     * Returns the instance after refreshing it from the backend. A status change
     * observed on the way is audited like any other transition.
     */
    public ChallengeInstanceDto getInstance(AuthenticatedUser actor, String deploymentName) {
        requireInstanceAccess(actor, instanceService.getInstance(deploymentName));
        InstanceService.ReconcileOutcome outcome = instanceService.reconcile(deploymentName);
        if (outcome.isChanged()) {
            auditReconciled(outcome);
        }
        return outcome.getInstance();
    }

    public List<ChallengeInstanceDto> listInstances(AuthenticatedUser actor) {
        return instanceService.listForUser(actor.getUserId());
    }

    public ChallengeInstanceDto reportInstanceFailure(String deploymentName, String reason) {
        Optional<ChallengeInstanceDto> failed = instanceService.markFailed(deploymentName, reason);
        if (failed.isEmpty()) {
            return instanceService.getInstance(deploymentName);
        }
        ChallengeInstanceDto instance = failed.get();
        auditLogService.append(AuditEventType.CHALLENGE_INSTANCE_FAILED, null, deploymentName,
                instance.getCompetitionId(), Map.of(
                        "ownerId", instance.getUserId().toString(),
                        "reason", reason));
        return instance;
    }

    // ── Progress ─────────────────────────────────────────────────────────────

    public ProgressService.ResetSummary resetProgress(AuthenticatedUser actor, UUID groupId, UUID userId) {
        competitionService.findGroup(groupId);
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User", userId.toString());
        }
        requireInstructor(actor, groupId);

        ProgressService.ResetSummary summary = progressService.resetUserProgress(userId, groupId);
        auditLogService.append(AuditEventType.GROUP_PROGRESS_RESET, actor.getUserId(), userId.toString(), groupId,
                Map.of(
                        "questionCompletionsRemoved", summary.getQuestionCompletionsRemoved(),
                        "challengeCompletionsRemoved", summary.getChallengeCompletionsRemoved(),
                        "previousPoints", summary.getPreviousPoints()));
        return summary;
    }

    public ProgressService.AnswerResult submitAnswer(AuthenticatedUser actor, UUID groupId, UUID challengeId,
            UUID questionId, String answer) {
        UUID userId = actor.getUserId();
        CompetitionGroup group = competitionService.findGroup(groupId);
        requireParticipant(actor, groupId);
        if (group.phaseAt(clock.instant()) != CompetitionGroup.Phase.ACTIVE) {
            throw new BusinessException("Competition is not active");
        }

        ProgressService.AnswerResult result = progressService.submitAnswer(userId, groupId, challengeId, questionId,
                answer);
        if (!result.isCorrect()) {
            auditLogService.append(AuditEventType.QUESTION_ATTEMPTED, userId, questionId.toString(), groupId,
                    Map.of("challengeId", challengeId.toString(), "correct", false));
            return result;
        }

        auditLogService.append(AuditEventType.QUESTION_COMPLETED, userId, questionId.toString(), groupId,
                Map.of("challengeId", challengeId.toString(), "pointsEarned", result.getQuestionPoints()));
        if (result.isChallengeCompleted()) {
            auditLogService.append(AuditEventType.CHALLENGE_COMPLETED, userId, challengeId.toString(), groupId,
                    Map.of("pointsEarned", result.getChallengePoints()));
        }
        return result;
    }

    /** Credits a whole challenge to a user, e.g. after an instructor verified a flag. */
    public ProgressService.CompletionResult recordCompletion(AuthenticatedUser actor, UUID groupId, UUID userId,
            UUID challengeId) {
        competitionService.findGroup(groupId);
        requireInstructor(actor, groupId);
        GroupChallenge groupChallenge = competitionService.findGroupChallenge(groupId, challengeId);

        ProgressService.CompletionResult result = progressService.recordCompletion(userId, groupChallenge.getId());
        auditLogService.append(AuditEventType.CHALLENGE_COMPLETED, actor.getUserId(), challengeId.toString(),
                groupId, Map.of("userId", userId.toString(), "pointsEarned", result.getPointsEarned()));
        return result;
    }

    public List<ProgressService.LeaderboardEntry> leaderboard(AuthenticatedUser actor, UUID groupId) {
        competitionService.findGroup(groupId);
        requireParticipant(actor, groupId);
        return progressService.leaderboard(groupId);
    }

    public Page<AuditEventDto> auditEvents(AuthenticatedUser actor, UUID groupId, Pageable pageable) {
        competitionService.findGroup(groupId);
        requireInstructor(actor, groupId);
        return auditLogService.listForGroup(groupId, pageable);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private InstanceService.StartOutcome startWithRetry(UUID userId, UUID groupId, Challenge challenge) {
        int attempt = 0;
        while (true) {
            try {
                return instanceService.startInstance(userId, groupId, challenge);
            } catch (ProvisionFailedException e) {
                if (!e.isRetryable() || attempt >= startRetries) {
                    throw e;
                }
                long delay = startBackoffMs * (1L << attempt);
                attempt++;
                log.warn("Start of challenge {} for user {} failed (attempt {}/{}), retrying in {} ms: {}",
                        challenge.getId(), userId, attempt, startRetries + 1, delay, e.getMessage());
                sleep(delay, e);
            }
        }
    }

    private void sleep(long millis, ProvisionFailedException pending) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw pending;
        }
    }

    private void auditReconciled(InstanceService.ReconcileOutcome outcome) {
        ChallengeInstanceDto instance = outcome.getInstance();
        AuditEventType type = switch (instance.getStatus()) {
            case RUNNING -> AuditEventType.CHALLENGE_INSTANCE_RUNNING;
            case FAILED -> AuditEventType.CHALLENGE_INSTANCE_FAILED;
            case TERMINATED -> AuditEventType.CHALLENGE_INSTANCE_DELETED;
            case PENDING -> null;
        };
        if (type == null) {
            return;
        }
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("ownerId", instance.getUserId().toString());
        metadata.put("previousStatus", outcome.getPreviousStatus().name());
        metadata.put("backendStatus", instance.getBackendStatus());
        metadata.put("reason", "BACKEND_REPORTED");
        auditLogService.append(type, null, instance.getDeploymentName(), instance.getCompetitionId(), metadata);
    }

    private int stopLiveInstances(UUID groupId, UUID actorId, String reason) {
        int stopped = 0;
        for (ChallengeInstanceDto live : instanceService.listLiveForCompetition(groupId)) {
            try {
                InstanceService.StopOutcome outcome = instanceService.stopInstance(live.getDeploymentName());
                if (outcome.isChanged()) {
                    stopped++;
                    auditLogService.append(AuditEventType.CHALLENGE_INSTANCE_DELETED, actorId,
                            live.getDeploymentName(), groupId, Map.of(
                                    "ownerId", live.getUserId().toString(),
                                    "backendConfirmed", outcome.isBackendConfirmed(),
                                    "reason", reason));
                }
            } catch (Exception e) {
                log.error("Failed to stop instance {} of competition {}: {}", live.getDeploymentName(), groupId,
                        e.getMessage());
            }
        }
        return stopped;
    }

    private void requireInstructor(AuthenticatedUser actor, UUID groupId) {
        if (actor.isAdmin() || membershipService.isInstructor(actor.getUserId(), groupId)) {
            return;
        }
        log.warn("Instructor access denied: userId={}, groupId={}", actor.getId(), groupId);
        throw new UnauthorizedAccessException("Only instructors of this competition may do this");
    }

    private void requireParticipant(AuthenticatedUser actor, UUID groupId) {
        if (actor.isAdmin() || membershipService.isParticipant(actor.getUserId(), groupId)) {
            return;
        }
        throw new UnauthorizedAccessException("You are not a member of this competition");
    }

    private void requireInstanceAccess(AuthenticatedUser actor, ChallengeInstanceDto instance) {
        if (actor.isAdmin() || instance.getUserId().equals(actor.getUserId())
                || membershipService.isInstructor(actor.getUserId(), instance.getCompetitionId())) {
            return;
        }
        throw new UnauthorizedAccessException("You do not have access to this challenge instance");
    }
}
