package com.edurange.ctf.modules.accesscode;

import com.edurange.ctf.modules.competition.CompetitionGroup;
import com.edurange.ctf.modules.competition.MembershipRole;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A time-bounded code that grants a role in one competition when redeemed.
 * Valid while {@code now < expiresAt}.
 */
@Entity
@Table(name = "access_codes")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccessCode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 16)
    private String code;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "group_id", nullable = false)
    private CompetitionGroup group;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "grant_role", nullable = false, length = 20)
    @Builder.Default
    private MembershipRole grantRole = MembershipRole.MEMBER;

    /** Null means any number of distinct users may redeem. */
    @Column(name = "max_uses")
    private Integer maxUses;

    @Column(name = "used_count", nullable = false)
    @Builder.Default
    private Integer usedCount = 0;

    /** Set once by the expiry sweep; guards against emitting the expiry event twice. */
    @Column(name = "expiry_processed_at")
    private Instant expiryProcessedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isExhausted() {
        return maxUses != null && usedCount >= maxUses;
    }
}
