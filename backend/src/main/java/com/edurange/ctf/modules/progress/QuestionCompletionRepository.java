package com.edurange.ctf.modules.progress;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface QuestionCompletionRepository extends JpaRepository<QuestionCompletion, UUID> {

    boolean existsByUserIdAndQuestionIdAndGroupChallengeId(UUID userId, UUID questionId, UUID groupChallengeId);

    long countByUserIdAndGroupChallengeId(UUID userId, UUID groupChallengeId);

    @Query("SELECT COALESCE(SUM(q.pointsEarned), 0) FROM QuestionCompletion q " +
            "WHERE q.userId = :userId AND q.groupChallenge.id = :groupChallengeId")
    int sumPointsByUserIdAndGroupChallengeId(@Param("userId") UUID userId,
            @Param("groupChallengeId") UUID groupChallengeId);

    @Modifying
    @Query("DELETE FROM QuestionCompletion q WHERE q.userId = :userId AND q.groupChallenge.id IN " +
            "(SELECT gc.id FROM GroupChallenge gc WHERE gc.group.id = :groupId)")
    int deleteByUserIdAndGroupId(@Param("userId") UUID userId, @Param("groupId") UUID groupId);

    @Modifying
    @Query("DELETE FROM QuestionCompletion q WHERE q.groupChallenge.id IN " +
            "(SELECT gc.id FROM GroupChallenge gc WHERE gc.group.id = :groupId)")
    int deleteByGroupId(@Param("groupId") UUID groupId);
}
