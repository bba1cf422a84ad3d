package com.edurange.ctf.modules.instance;

import com.edurange.ctf.modules.challenge.Challenge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.EnumSet;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ChallengeInstanceRepositoryTest {

    @Autowired
    private ChallengeInstanceRepository instanceRepository;

    @Autowired
    private TestEntityManager entityManager;

    private final UUID userId = UUID.randomUUID();
    private final UUID challengeId = UUID.randomUUID();
    private final UUID competitionId = UUID.randomUUID();

    @Test
    @DisplayName("a second live instance for the same user and challenge is refused")
    void saveAndFlush_secondLiveInstance_violatesActiveKey() {
        instanceRepository.saveAndFlush(live("web-1"));

        assertThrows(DataIntegrityViolationException.class, () -> instanceRepository.saveAndFlush(live("web-2")));
    }

    @Test
    @DisplayName("terminated instances release the slot")
    void saveAndFlush_afterTermination_allowsNewLiveInstance() {
        ChallengeInstance first = instanceRepository.saveAndFlush(live("web-1"));
        first.transitionTo(InstanceStatus.TERMINATED, InstanceStatus.Source.LOCAL, Instant.now());
        instanceRepository.saveAndFlush(first);

        ChallengeInstance second = instanceRepository.saveAndFlush(live("web-2"));
        second.transitionTo(InstanceStatus.FAILED, InstanceStatus.Source.LOCAL, Instant.now());
        instanceRepository.saveAndFlush(second);

        instanceRepository.saveAndFlush(live("web-3"));

        assertThat(instanceRepository.findByActiveKey(ChallengeInstance.activeKeyOf(userId, challengeId)))
                .get()
                .extracting(ChallengeInstance::getDeploymentName)
                .isEqualTo("web-3");
        assertThat(instanceRepository.countLiveByUserAndCompetition(userId, competitionId)).isEqualTo(1);
        assertThat(instanceRepository.findByUserIdAndChallengeIdAndStatusIn(userId, challengeId,
                EnumSet.of(InstanceStatus.PENDING, InstanceStatus.RUNNING))).hasSize(1);
    }

    @Test
    @DisplayName("a copy loaded before termination cannot write the row back to live")
    void saveAndFlush_staleCopyAfterTermination_isRejected() {
        // given
        ChallengeInstance stale = instanceRepository.saveAndFlush(live("web-1"));
        entityManager.detach(stale);
        ChallengeInstance current = instanceRepository.findByDeploymentName("web-1").orElseThrow();
        current.transitionTo(InstanceStatus.TERMINATED, InstanceStatus.Source.LOCAL, Instant.now());
        instanceRepository.saveAndFlush(current);
        assertThat(current.getVersion()).isEqualTo(1L);

        // when
        stale.transitionTo(InstanceStatus.RUNNING, InstanceStatus.Source.BACKEND, Instant.now());
        stale.setBackendStatus("active");

        // then
        assertThat(stale.getVersion()).isZero();
        assertThrows(ObjectOptimisticLockingFailureException.class, () -> instanceRepository.saveAndFlush(stale));
    }

    private ChallengeInstance live(String deploymentName) {
        return ChallengeInstance.builder()
                .userId(userId)
                .challengeId(challengeId)
                .competitionId(competitionId)
                .challengeImage("registry.local/web-fu:1")
                .challengeType(Challenge.ChallengeType.WEB)
                .deploymentName(deploymentName)
                .status(InstanceStatus.PENDING)
                .statusSource(InstanceStatus.Source.BACKEND)
                .activeKey(ChallengeInstance.activeKeyOf(userId, challengeId))
                .build();
    }
}
