package com.edurange.ctf.modules.accesscode;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccessCodeRepository extends JpaRepository<AccessCode, UUID> {

    boolean existsByCode(String code);

    /** Row lock held until the redeeming transaction commits. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM AccessCode c JOIN FETCH c.group WHERE c.code = :code")
    Optional<AccessCode> findByCodeForUpdate(@Param("code") String code);

    List<AccessCode> findByGroupIdOrderByCreatedAtDesc(UUID groupId);

    Optional<AccessCode> findByIdAndGroupId(UUID id, UUID groupId);

    @Query("SELECT c FROM AccessCode c WHERE c.expiresAt <= :now AND c.expiryProcessedAt IS NULL")
    List<AccessCode> findExpiredUnprocessed(@Param("now") Instant now);

    /** Returns 1 for the caller that claims the code, 0 if it was already claimed. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AccessCode c SET c.expiryProcessedAt = :now " +
            "WHERE c.id = :id AND c.expiryProcessedAt IS NULL")
    int claimExpiry(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM AccessCode c WHERE c.group.id = :groupId")
    int deleteByGroupId(@Param("groupId") UUID groupId);
}
