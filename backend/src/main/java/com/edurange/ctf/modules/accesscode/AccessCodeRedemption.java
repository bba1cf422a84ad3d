package com.edurange.ctf.modules.accesscode;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "access_code_redemptions", uniqueConstraints = @UniqueConstraint(
        name = "uk_redemption_code_user",
        columnNames = { "access_code_id", "user_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccessCodeRedemption {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "access_code_id", nullable = false)
    private AccessCode accessCode;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @CreationTimestamp
    @Column(name = "redeemed_at", updatable = false)
    private Instant redeemedAt;
}
