package com.edurange.ctf.modules.accesscode;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface AccessCodeRedemptionRepository extends JpaRepository<AccessCodeRedemption, UUID> {

    boolean existsByAccessCodeIdAndUserId(UUID accessCodeId, UUID userId);

    long countByAccessCodeId(UUID accessCodeId);

    @Modifying
    @Query("DELETE FROM AccessCodeRedemption r WHERE r.accessCode.id = :accessCodeId")
    int deleteByAccessCodeId(@Param("accessCodeId") UUID accessCodeId);

    @Modifying
    @Query("DELETE FROM AccessCodeRedemption r WHERE r.accessCode.id IN " +
            "(SELECT c.id FROM AccessCode c WHERE c.group.id = :groupId)")
    int deleteByGroupId(@Param("groupId") UUID groupId);
}
