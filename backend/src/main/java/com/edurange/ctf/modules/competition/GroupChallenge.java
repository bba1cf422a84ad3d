package com.edurange.ctf.modules.competition;

import com.edurange.ctf.modules.challenge.Challenge;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/** A challenge assigned to a competition, with the points it is worth there. */
@Entity
@Table(name = "group_challenges", uniqueConstraints = @UniqueConstraint(
        name = "uk_group_challenge",
        columnNames = { "group_id", "challenge_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GroupChallenge {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "group_id", nullable = false)
    private CompetitionGroup group;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "challenge_id", nullable = false)
    private Challenge challenge;

    @Column(nullable = false)
    @Builder.Default
    private Integer points = 0;
}
