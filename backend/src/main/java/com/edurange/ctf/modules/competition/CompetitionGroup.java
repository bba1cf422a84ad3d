package com.edurange.ctf.modules.competition;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "competition_groups")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompetitionGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    /** Null means the competition is open-ended. */
    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public Phase phaseAt(Instant now) {
        if (now.isBefore(startDate)) {
            return Phase.UPCOMING;
        }
        if (hasEndedAt(now)) {
            return Phase.COMPLETED;
        }
        return Phase.ACTIVE;
    }

    public boolean hasEndedAt(Instant now) {
        return endDate != null && !now.isBefore(endDate);
    }

    public enum Phase {
        UPCOMING, ACTIVE, COMPLETED
    }
}
