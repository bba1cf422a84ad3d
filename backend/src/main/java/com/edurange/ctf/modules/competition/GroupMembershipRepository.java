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
public interface GroupMembershipRepository extends JpaRepository<GroupMembership, UUID> {

    Optional<GroupMembership> findByGroupIdAndUserIdAndRole(UUID groupId, UUID userId, MembershipRole role);

    boolean existsByGroupIdAndUserIdAndRole(UUID groupId, UUID userId, MembershipRole role);

    boolean existsByGroupIdAndUserId(UUID groupId, UUID userId);

    List<GroupMembership> findByGroupIdAndRole(UUID groupId, MembershipRole role);

    // Group fetched eagerly: the caller partitions by start/end date
    @Query("SELECT m FROM GroupMembership m JOIN FETCH m.group WHERE m.userId = :userId")
    List<GroupMembership> findByUserIdWithGroup(@Param("userId") UUID userId);

    long countByGroupIdAndRole(UUID groupId, MembershipRole role);

    @Modifying
    @Query("DELETE FROM GroupMembership m WHERE m.group.id = :groupId")
    int deleteByGroupId(@Param("groupId") UUID groupId);
}
