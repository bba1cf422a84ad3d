package com.edurange.ctf.modules.instance;

import com.edurange.ctf.exception.InternalInconsistencyException;
import com.edurange.ctf.exception.ProvisionFailedException;
import com.edurange.ctf.exception.ResourceNotFoundException;
import com.edurange.ctf.modules.challenge.Challenge;
import com.edurange.ctf.modules.instance.dto.ChallengeInstanceDto;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Keeps the local instance table in step with the orchestration backend.
 *
 * <p>Backend calls are made outside any database transaction. A row is only
 * written after the backend has returned a deployment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InstanceService {

    static final Set<InstanceStatus> LIVE = EnumSet.of(InstanceStatus.PENDING, InstanceStatus.RUNNING);

    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final ChallengeInstanceRepository instanceRepository;
    private final OrchestratorClient orchestratorClient;
    private final InstanceStatusNotifier notifier;
    private final Clock clock;

    /**
     * Returns the user's live instance of the challenge, or provisions one.
     *
     * @throws ProvisionFailedException       when the backend fails; nothing is stored
     * @throws InternalInconsistencyException when more than one live row exists
     */
    public StartOutcome startInstance(UUID userId, UUID competitionId, Challenge challenge) {
        Optional<ChallengeInstance> existing = findLive(userId, challenge.getId());
        if (existing.isPresent()) {
            log.info("Reusing live instance {} for userId={}, challengeId={}",
                    existing.get().getDeploymentName(), userId, challenge.getId());
            return StartOutcome.builder().instance(ChallengeInstanceDto.from(existing.get())).created(false).build();
        }

        OrchestratorClient.StartResponse response = orchestratorClient.start(OrchestratorClient.StartRequest.builder()
                .userId(userId.toString())
                .challengeId(challenge.getId().toString())
                .challengeImage(challenge.getChallengeImage())
                .appsConfig(challenge.getAppsConfig())
                .chalType(challenge.getChallengeType().wireName())
                .competitionId(competitionId.toString())
                .build());

        Instant now = clock.instant();
        ChallengeInstance instance = ChallengeInstance.builder()
                .userId(userId)
                .challengeId(challenge.getId())
                .competitionId(competitionId)
                .challengeImage(challenge.getChallengeImage())
                .challengeType(challenge.getChallengeType())
                .deploymentName(response.getDeploymentName())
                .challengeUrl(response.getChallengeUrl())
                .terminalUrl(response.getTerminalUrl())
                .flagSecretName(response.getFlagSecretName())
                .backendStatus(response.getStatus())
                .status(InstanceStatus.PENDING)
                .statusSource(InstanceStatus.Source.BACKEND)
                .activeKey(ChallengeInstance.activeKeyOf(userId, challenge.getId()))
                .lastReconciledAt(now)
                .build();
        instance.transitionTo(OrchestratorClient.mapStatus(response.getStatus()), InstanceStatus.Source.BACKEND, now);

        try {
            instance = instanceRepository.saveAndFlush(instance);
        } catch (DataIntegrityViolationException e) {
            return resolveLostRace(userId, challenge.getId(), response.getDeploymentName(), e);
        }

        log.info("Instance created: deployment={}, userId={}, challengeId={}, competitionId={}, status={}",
                instance.getDeploymentName(), userId, challenge.getId(), competitionId, instance.getStatus());
        ChallengeInstanceDto dto = ChallengeInstanceDto.from(instance);
        notifier.statusChanged(dto);
        return StartOutcome.builder().instance(dto).created(true).build();
    }

    /**
     * Asks the backend to remove the deployment and marks the row TERMINATED
     * (source LOCAL) whether or not the backend call succeeds.
     */
    public StopOutcome stopInstance(String deploymentName) {
        ChallengeInstance instance = getByDeploymentName(deploymentName);
        if (instance.getStatus() == InstanceStatus.TERMINATED) {
            return StopOutcome.builder().instance(ChallengeInstanceDto.from(instance)).changed(false)
                    .backendConfirmed(false).build();
        }

        boolean backendConfirmed = true;
        try {
            orchestratorClient.stop(deploymentName);
        } catch (ProvisionFailedException e) {
            backendConfirmed = false;
            log.warn("Backend termination of {} failed, marking terminated locally: {}", deploymentName,
                    e.getMessage());
        }

        Instant now = clock.instant();
        Write write = applyAndSave(instance,
                row -> row.transitionTo(InstanceStatus.TERMINATED, InstanceStatus.Source.LOCAL, now));
        ChallengeInstanceDto dto = ChallengeInstanceDto.from(write.instance());
        if (write.changed()) {
            notifier.statusChanged(dto);
        }
        return StopOutcome.builder().instance(dto).changed(write.changed()).backendConfirmed(backendConfirmed)
                .build();
    }

    /**
     * Refreshes the row from the backend. Terminal rows stay terminal; a backend
     * that cannot be reached leaves the cached row as it was. A row that turned
     * terminal while the backend was being asked is returned as stored.
     */
    public ReconcileOutcome reconcile(String deploymentName) {
        ChallengeInstance instance = getByDeploymentName(deploymentName);
        if (instance.getStatus().isTerminal()) {
            return ReconcileOutcome.unchanged(ChallengeInstanceDto.from(instance));
        }

        OrchestratorClient.PodStatus observed;
        try {
            observed = orchestratorClient.fetchStatus(deploymentName);
        } catch (ProvisionFailedException e) {
            log.warn("Status of {} could not be reconciled: {}", deploymentName, e.getMessage());
            return ReconcileOutcome.unchanged(ChallengeInstanceDto.from(instance));
        }

        Instant now = clock.instant();
        Write write = applyAndSave(instance, row -> {
            if (row.getStatus().isTerminal()) {
                return false;
            }
            row.transitionTo(observed.getStatus(), InstanceStatus.Source.BACKEND, now);
            row.setBackendStatus(observed.getRaw());
            row.setLastReconciledAt(now);
            return true;
        });

        ChallengeInstanceDto dto = ChallengeInstanceDto.from(write.instance());
        if (!write.changed()) {
            return ReconcileOutcome.unchanged(dto);
        }
        log.info("Instance {} reconciled: {} -> {} (backend={})", deploymentName, write.previousStatus(),
                dto.getStatus(), observed.getRaw());
        notifier.statusChanged(dto);
        return ReconcileOutcome.builder()
                .instance(dto)
                .changed(true)
                .previousStatus(write.previousStatus())
                .build();
    }

    /**
     * Records a failure reported by monitoring.
     *
     * @return the instance when it moved to FAILED, empty when it was already terminal
     */
    public Optional<ChallengeInstanceDto> markFailed(String deploymentName, String reason) {
        Instant now = clock.instant();
        Write write = applyAndSave(getByDeploymentName(deploymentName), row -> {
            if (!row.transitionTo(InstanceStatus.FAILED, InstanceStatus.Source.LOCAL, now)) {
                return false;
            }
            row.setFailureReason(reason);
            return true;
        });
        if (!write.changed()) {
            log.debug("Failure report for {} ignored: already {}", deploymentName, write.instance().getStatus());
            return Optional.empty();
        }
        ChallengeInstanceDto dto = ChallengeInstanceDto.from(write.instance());
        log.warn("Instance {} marked FAILED: {}", deploymentName, reason);
        notifier.statusChanged(dto);
        return Optional.of(dto);
    }

    @Transactional(readOnly = true)
    public List<ChallengeInstanceDto> listForUser(UUID userId) {
        return instanceRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(ChallengeInstanceDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ChallengeInstanceDto> listLiveForCompetition(UUID competitionId) {
        return instanceRepository.findByCompetitionIdAndStatusIn(competitionId, LIVE).stream()
                .map(ChallengeInstanceDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countLive(UUID userId, UUID competitionId) {
        return instanceRepository.countLiveByUserAndCompetition(userId, competitionId);
    }

    @Transactional(readOnly = true)
    public ChallengeInstanceDto getInstance(String deploymentName) {
        return ChallengeInstanceDto.from(getByDeploymentName(deploymentName));
    }

    private ChallengeInstance getByDeploymentName(String deploymentName) {
        return instanceRepository.findByDeploymentName(deploymentName)
                .orElseThrow(() -> new ResourceNotFoundException("ChallengeInstance", deploymentName));
    }

    /**
     * Applies {@code change} and stores the row. When another writer saved the
     * row first, the current version is reloaded and the change applied to it
     * again, so a stale copy never overwrites a newer status.
     *
     * @param change mutates the row and returns whether it needs writing
     */
    private Write applyAndSave(ChallengeInstance instance, Predicate<ChallengeInstance> change) {
        ChallengeInstance current = instance;
        for (int attempt = 1; ; attempt++) {
            InstanceStatus before = current.getStatus();
            if (!change.test(current)) {
                return new Write(current, before, false);
            }
            try {
                ChallengeInstance saved = instanceRepository.save(current);
                return new Write(saved, before, saved.getStatus() != before);
            } catch (ObjectOptimisticLockingFailureException e) {
                if (attempt >= MAX_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.info("Instance {} was modified concurrently, reloading (attempt {}/{})",
                        current.getDeploymentName(), attempt, MAX_WRITE_ATTEMPTS);
                current = getByDeploymentName(current.getDeploymentName());
            }
        }
    }

    private Optional<ChallengeInstance> findLive(UUID userId, UUID challengeId) {
        List<ChallengeInstance> live = instanceRepository.findByUserIdAndChallengeIdAndStatusIn(userId, challengeId,
                LIVE);
        if (live.size() > 1) {
            log.error("Found {} live instances for userId={}, challengeId={}: {}", live.size(), userId, challengeId,
                    live.stream().map(ChallengeInstance::getDeploymentName).toList());
            throw new InternalInconsistencyException(
                    "Multiple live instances for user " + userId + " and challenge " + challengeId);
        }
        return live.stream().findFirst();
    }

    private StartOutcome resolveLostRace(UUID userId, UUID challengeId, String redundantDeployment,
            DataIntegrityViolationException cause) {
        Optional<ChallengeInstance> winner = instanceRepository
                .findByActiveKey(ChallengeInstance.activeKeyOf(userId, challengeId));
        try {
            orchestratorClient.stop(redundantDeployment);
        } catch (ProvisionFailedException e) {
            log.error("Redundant deployment {} could not be removed: {}", redundantDeployment, e.getMessage());
        }
        if (winner.isEmpty()) {
            throw new InternalInconsistencyException("Instance insert for " + redundantDeployment
                    + " violated a constraint without a live winner: " + cause.getMostSpecificCause().getMessage());
        }
        log.info("Concurrent start for userId={}, challengeId={} resolved to {}; removed redundant {}",
                userId, challengeId, winner.get().getDeploymentName(), redundantDeployment);
        return StartOutcome.builder().instance(ChallengeInstanceDto.from(winner.get())).created(false).build();
    }

    private record Write(ChallengeInstance instance, InstanceStatus previousStatus, boolean changed) {
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    @Data
    @Builder
    public static class StartOutcome {
        private ChallengeInstanceDto instance;
        /** False when an existing live instance was returned. */
        private boolean created;
    }

    @Data
    @Builder
    public static class StopOutcome {
        private ChallengeInstanceDto instance;
        private boolean changed;
        private boolean backendConfirmed;
    }

    @Data
    @Builder
    public static class ReconcileOutcome {
        private ChallengeInstanceDto instance;
        private boolean changed;
        /** Status before the backend report was applied; null when nothing changed. */
        private InstanceStatus previousStatus;

        static ReconcileOutcome unchanged(ChallengeInstanceDto instance) {
            return ReconcileOutcome.builder().instance(instance).changed(false).build();
        }
    }
}
