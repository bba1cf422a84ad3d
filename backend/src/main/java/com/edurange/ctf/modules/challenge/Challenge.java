package com.edurange.ctf.modules.challenge;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "challenges")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Challenge {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "challenge_image", nullable = false, length = 255)
    private String challengeImage;

    @Enumerated(EnumType.STRING)
    @Column(name = "challenge_type", nullable = false, length = 20)
    @Builder.Default
    private ChallengeType challengeType = ChallengeType.FULLOS;

    /** Desktop app definitions forwarded verbatim to the orchestration backend. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "apps_config")
    private List<Map<String, Object>> appsConfig;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public enum ChallengeType {
        FULLOS, WEB, METASPLOIT;

        /** Value of {@code chal_type} on the orchestration wire. */
        public String wireName() {
            return name().toLowerCase();
        }
    }
}
