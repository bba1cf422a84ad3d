package com.edurange.ctf.scheduler;

import com.edurange.ctf.modules.lifecycle.LifecycleCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional in-process triggers for the lifecycle sweeps. Both crons default to
 * "-" (disabled); deployments usually call the /api/internal endpoints instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LifecycleScheduler {

    private final LifecycleCoordinator coordinator;

    // Non-transactional: each code claim commits on its own
    @Scheduled(cron = "${lifecycle.access-codes.sweep-cron:-}")
    public void expireAccessCodes() {
        try {
            int expired = coordinator.expireAccessCodes();
            if (expired > 0) {
                log.info("Scheduled sweep marked {} access code(s) expired", expired);
            }
        } catch (Exception e) {
            log.error("Scheduled access code sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${lifecycle.competitions.terminate-ended-cron:-}")
    public void terminateEndedCompetitions() {
        try {
            int stopped = coordinator.terminateEndedCompetitions();
            if (stopped > 0) {
                log.info("Scheduled competition-end check stopped {} instance(s)", stopped);
            }
        } catch (Exception e) {
            log.error("Scheduled competition-end check failed: {}", e.getMessage(), e);
        }
    }
}
