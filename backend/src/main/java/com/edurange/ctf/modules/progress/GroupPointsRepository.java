package com.edurange.ctf.modules.progress;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GroupPointsRepository extends JpaRepository<GroupPoints, UUID> {

    @Query("SELECT p.points FROM GroupPoints p WHERE p.userId = :userId AND p.group.id = :groupId")
    Optional<Integer> findPoints(@Param("userId") UUID userId, @Param("groupId") UUID groupId);

    /** Row lock held until the resetting transaction commits. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM GroupPoints p WHERE p.userId = :userId AND p.group.id = :groupId")
    Optional<GroupPoints> findByUserIdAndGroupIdForUpdate(@Param("userId") UUID userId,
                                                          @Param("groupId") UUID groupId);

    List<GroupPoints> findByGroupIdOrderByPointsDesc(UUID groupId);

    /** Returns 0 when the user has no balance row in the group yet. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE GroupPoints p SET p.points = p.points + :delta " +
            "WHERE p.userId = :userId AND p.group.id = :groupId")
    int addPoints(@Param("userId") UUID userId, @Param("groupId") UUID groupId, @Param("delta") int delta);

    @Modifying
    @Query("DELETE FROM GroupPoints p WHERE p.group.id = :groupId")
    int deleteByGroupId(@Param("groupId") UUID groupId);
}
