package com.edurange.ctf.modules.accesscode;

import com.edurange.ctf.modules.audit.AuditEventType;
import com.edurange.ctf.modules.audit.AuditLogService;
import com.edurange.ctf.modules.competition.CompetitionGroup;
import com.edurange.ctf.modules.competition.MembershipRole;
import com.edurange.ctf.modules.competition.MembershipService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(AccessCodeService.class)
class AccessCodeSweepJpaTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private AccessCodeService accessCodeService;

    @Autowired
    private AccessCodeRepository accessCodeRepository;

    @Autowired
    private TestEntityManager entityManager;

    @MockBean
    private MembershipService membershipService;

    @MockBean
    private AuditLogService auditLogService;

    private CompetitionGroup group;
    private AccessCode expiredYesterday;
    private AccessCode expiringNow;
    private AccessCode live;

    @BeforeEach
    void setUp() {
        group = entityManager.persist(CompetitionGroup.builder()
                .name("Spring CTF")
                .startDate(NOW.minusSeconds(86_400))
                .createdBy(UUID.randomUUID())
                .build());
        expiredYesterday = entityManager.persist(code("EXPIRED1", NOW.minusSeconds(86_400)));
        expiringNow = entityManager.persist(code("EXPIRED2", NOW));
        live = entityManager.persist(code("LIVECODE", NOW.plusSeconds(3_600)));
        entityManager.flush();
    }

    @Test
    @DisplayName("a second sweep claims nothing and emits no further events")
    void sweepExpired_twice_claimsEachCodeOnce() {
        // when
        int first = accessCodeService.sweepExpired();
        int second = accessCodeService.sweepExpired();

        // then
        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        assertThat(accessCodeRepository.claimExpiry(expiredYesterday.getId(), NOW)).isZero();
        verify(auditLogService, times(2)).append(eq(AuditEventType.ACCESS_CODE_EXPIRED), isNull(), any(),
                eq(group.getId()), anyMap());
        verify(auditLogService).append(eq(AuditEventType.ACCESS_CODE_EXPIRED), isNull(),
                eq(expiringNow.getId().toString()), eq(group.getId()), anyMap());
    }

    @Test
    @DisplayName("codes that have not expired are left unprocessed")
    void sweepExpired_liveCode_isNotClaimed() {
        accessCodeService.sweepExpired();

        AccessCode reloaded = accessCodeRepository.findById(live.getId()).orElseThrow();
        assertThat(reloaded.getExpiryProcessedAt()).isNull();
        assertThat(accessCodeRepository.findById(expiredYesterday.getId()).orElseThrow().getExpiryProcessedAt())
                .isEqualTo(NOW);
        assertThat(accessCodeRepository.findExpiredUnprocessed(NOW)).isEmpty();
    }

    private AccessCode code(String value, Instant expiresAt) {
        return AccessCode.builder()
                .code(value)
                .group(group)
                .createdBy(group.getCreatedBy())
                .expiresAt(expiresAt)
                .grantRole(MembershipRole.MEMBER)
                .build();
    }
}
