package com.edurange.ctf.modules.progress;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ChallengeCompletionRepository extends JpaRepository<ChallengeCompletion, UUID> {

    boolean existsByUserIdAndGroupChallengeId(UUID userId, UUID groupChallengeId);

    @Query("SELECT c FROM ChallengeCompletion c WHERE c.userId = :userId AND c.groupChallenge.group.id = :groupId")
    List<ChallengeCompletion> findByUserIdAndGroupId(@Param("userId") UUID userId, @Param("groupId") UUID groupId);

    @Modifying
    @Query("DELETE FROM ChallengeCompletion c WHERE c.userId = :userId AND c.groupChallenge.id IN " +
            "(SELECT gc.id FROM GroupChallenge gc WHERE gc.group.id = :groupId)")
    int deleteByUserIdAndGroupId(@Param("userId") UUID userId, @Param("groupId") UUID groupId);

    @Modifying
    @Query("DELETE FROM ChallengeCompletion c WHERE c.groupChallenge.id IN " +
            "(SELECT gc.id FROM GroupChallenge gc WHERE gc.group.id = :groupId)")
    int deleteByGroupId(@Param("groupId") UUID groupId);
}
