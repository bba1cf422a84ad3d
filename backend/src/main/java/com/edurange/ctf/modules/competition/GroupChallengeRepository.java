package com.edurange.ctf.modules.competition;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GroupChallengeRepository extends JpaRepository<GroupChallenge, UUID> {

    Optional<GroupChallenge> findByGroupIdAndChallengeId(UUID groupId, UUID challengeId);

    @Query("SELECT gc FROM GroupChallenge gc JOIN FETCH gc.challenge WHERE gc.group.id = :groupId")
    List<GroupChallenge> findByGroupIdWithChallenge(@Param("groupId") UUID groupId);

    @Modifying
    @Query("DELETE FROM GroupChallenge gc WHERE gc.group.id = :groupId")
    int deleteByGroupId(@Param("groupId") UUID groupId);
}
