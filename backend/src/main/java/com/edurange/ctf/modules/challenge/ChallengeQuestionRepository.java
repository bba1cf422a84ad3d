package com.edurange.ctf.modules.challenge;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChallengeQuestionRepository extends JpaRepository<ChallengeQuestion, UUID> {

    List<ChallengeQuestion> findByChallengeIdOrderByPositionAsc(UUID challengeId);

    Optional<ChallengeQuestion> findByIdAndChallengeId(UUID id, UUID challengeId);

    long countByChallengeId(UUID challengeId);
}
