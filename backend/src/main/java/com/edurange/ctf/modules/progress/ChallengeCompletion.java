package com.edurange.ctf.modules.progress;

import com.edurange.ctf.modules.competition.GroupChallenge;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "challenge_completions", uniqueConstraints = @UniqueConstraint(
        name = "uk_challenge_completion_user",
        columnNames = { "user_id", "group_challenge_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChallengeCompletion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "group_challenge_id", nullable = false)
    private GroupChallenge groupChallenge;

    @Column(name = "points_earned", nullable = false)
    private Integer pointsEarned;

    @CreationTimestamp
    @Column(name = "completed_at", updatable = false)
    private Instant completedAt;
}
