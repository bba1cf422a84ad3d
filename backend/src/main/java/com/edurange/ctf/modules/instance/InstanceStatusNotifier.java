package com.edurange.ctf.modules.instance;

import com.edurange.ctf.modules.instance.dto.ChallengeInstanceDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Pushes instance status changes to the owning user.
 * Client subscribes to: /queue/instances/{userId}
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InstanceStatusNotifier {

    private final SimpMessagingTemplate messagingTemplate;

    public void statusChanged(ChallengeInstanceDto instance) {
        try {
            messagingTemplate.convertAndSend("/queue/instances/" + instance.getUserId(), instance);
            log.debug("Instance update sent to user {}: {} -> {}", instance.getUserId(),
                    instance.getDeploymentName(), instance.getStatus());
        } catch (Exception e) {
            log.warn("Instance update for {} not delivered: {}", instance.getDeploymentName(), e.getMessage());
        }
    }
}
