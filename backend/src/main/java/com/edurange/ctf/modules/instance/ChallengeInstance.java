package com.edurange.ctf.modules.instance;

import com.edurange.ctf.modules.challenge.Challenge;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Local record of one provisioned challenge environment.
 *
 * <p>{@code deploymentName}, {@code challengeUrl}, {@code terminalUrl},
 * {@code flagSecretName} and {@code backendStatus} are copied from backend
 * responses only. {@code activeKey} is {@code userId:challengeId} while the
 * instance is live and null once terminal; its unique constraint allows a
 * single live instance per user and challenge.
 */
@Entity
@Table(name = "challenge_instances")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChallengeInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "challenge_id", nullable = false)
    private UUID challengeId;

    @Column(name = "competition_id", nullable = false)
    private UUID competitionId;

    @Column(name = "challenge_image", nullable = false, length = 255)
    private String challengeImage;

    @Enumerated(EnumType.STRING)
    @Column(name = "challenge_type", nullable = false, length = 20)
    private Challenge.ChallengeType challengeType;

    @Column(name = "deployment_name", nullable = false, unique = true, length = 255)
    private String deploymentName;

    @Column(name = "challenge_url", length = 500)
    private String challengeUrl;

    @Column(name = "terminal_url", length = 500)
    private String terminalUrl;

    @Column(name = "flag_secret_name", length = 255)
    private String flagSecretName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private InstanceStatus status = InstanceStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "status_source", nullable = false, length = 20)
    @Builder.Default
    private InstanceStatus.Source statusSource = InstanceStatus.Source.BACKEND;

    /** Raw status string last reported by the backend. */
    @Column(name = "backend_status", length = 50)
    private String backendStatus;

    @Column(name = "active_key", unique = true, length = 80)
    private String activeKey;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "last_reconciled_at")
    private Instant lastReconciledAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "terminated_at")
    private Instant terminatedAt;

    /** Rejects writes from a copy loaded before another writer's update. */
    @Version
    @Column(nullable = false)
    private Long version;

    public static String activeKeyOf(UUID userId, UUID challengeId) {
        return userId + ":" + challengeId;
    }

    /**
     * Applies {@code target} when the state machine allows it.
     *
     * @return whether the status changed
     */
    public boolean transitionTo(InstanceStatus target, InstanceStatus.Source source, Instant now) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        statusSource = source;
        if (target.isTerminal()) {
            activeKey = null;
            terminatedAt = now;
        }
        return true;
    }
}
