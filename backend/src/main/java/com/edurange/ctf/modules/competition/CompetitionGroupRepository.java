package com.edurange.ctf.modules.competition;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompetitionGroupRepository extends JpaRepository<CompetitionGroup, UUID> {

    List<CompetitionGroup> findByEndDateIsNotNullAndEndDateLessThanEqual(Instant now);

    /** Serializes the creation of per-user rows that hang off the group. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM CompetitionGroup g WHERE g.id = :id")
    Optional<CompetitionGroup> findByIdForUpdate(@Param("id") UUID id);
}
