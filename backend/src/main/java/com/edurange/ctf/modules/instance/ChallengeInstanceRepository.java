package com.edurange.ctf.modules.instance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChallengeInstanceRepository extends JpaRepository<ChallengeInstance, UUID> {

    Optional<ChallengeInstance> findByDeploymentName(String deploymentName);

    Optional<ChallengeInstance> findByActiveKey(String activeKey);

    List<ChallengeInstance> findByUserIdAndChallengeIdAndStatusIn(UUID userId, UUID challengeId,
            Collection<InstanceStatus> statuses);

    List<ChallengeInstance> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<ChallengeInstance> findByCompetitionIdAndStatusIn(UUID competitionId, Collection<InstanceStatus> statuses);

    @Query("SELECT COUNT(i) FROM ChallengeInstance i WHERE i.userId = :userId " +
            "AND i.competitionId = :competitionId AND i.activeKey IS NOT NULL")
    long countLiveByUserAndCompetition(@Param("userId") UUID userId, @Param("competitionId") UUID competitionId);
}
