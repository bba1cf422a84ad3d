package com.edurange.ctf.modules.progress;

import com.edurange.ctf.modules.competition.CompetitionGroup;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/** Running points balance of one user in one competition. */
@Entity
@Table(name = "group_points", uniqueConstraints = @UniqueConstraint(
        name = "uk_group_points_user",
        columnNames = { "user_id", "group_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GroupPoints {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "group_id", nullable = false)
    private CompetitionGroup group;

    @Column(nullable = false)
    @Builder.Default
    private Integer points = 0;
}
