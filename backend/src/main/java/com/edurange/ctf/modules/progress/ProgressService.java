package com.edurange.ctf.modules.progress;

import com.edurange.ctf.exception.DuplicateCompletionException;
import com.edurange.ctf.exception.ResourceNotFoundException;
import com.edurange.ctf.modules.challenge.ChallengeQuestion;
import com.edurange.ctf.modules.challenge.ChallengeQuestionRepository;
import com.edurange.ctf.modules.competition.CompetitionGroup;
import com.edurange.ctf.modules.competition.CompetitionGroupRepository;
import com.edurange.ctf.modules.competition.GroupChallenge;
import com.edurange.ctf.modules.competition.GroupChallengeRepository;
import com.edurange.ctf.modules.user.User;
import com.edurange.ctf.modules.user.UserRepository;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Completions and points per user per competition.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressService {

    private final ChallengeCompletionRepository challengeCompletionRepository;
    private final QuestionCompletionRepository questionCompletionRepository;
    private final GroupPointsRepository groupPointsRepository;
    private final GroupChallengeRepository groupChallengeRepository;
    private final CompetitionGroupRepository groupRepository;
    private final ChallengeQuestionRepository questionRepository;
    private final UserRepository userRepository;

    // ── Challenge completion ─────────────────────────────────────────────────

    /**
     * Records that the user completed the group challenge and credits its points.
     * A second call for the same pair fails with {@link DuplicateCompletionException}
     * and leaves the balance untouched.
     */
    @Transactional
    public CompletionResult recordCompletion(UUID userId, UUID groupChallengeId) {
        GroupChallenge groupChallenge = groupChallengeRepository.findById(groupChallengeId)
                .orElseThrow(() -> new ResourceNotFoundException("GroupChallenge", groupChallengeId.toString()));

        if (challengeCompletionRepository.existsByUserIdAndGroupChallengeId(userId, groupChallengeId)) {
            throw new DuplicateCompletionException("Challenge already completed by this user");
        }

        int points = groupChallenge.getPoints();
        UUID groupId = groupChallenge.getGroup().getId();
        UUID challengeId = groupChallenge.getChallenge().getId();
        saveChallengeCompletion(userId, groupChallenge, points);
        int balance = credit(userId, groupId, points);

        log.info("Challenge completed: userId={}, groupChallengeId={}, points={}, balance={}",
                userId, groupChallengeId, points, balance);
        return CompletionResult.builder()
                .groupId(groupId)
                .challengeId(challengeId)
                .pointsEarned(points)
                .totalPoints(balance)
                .build();
    }

    // ── Question answers ─────────────────────────────────────────────────────

    /**
     * Checks an answer. A correct answer records the question; once every question
     * of the challenge is solved the challenge completes and the summed question
     * points are credited.
     */
    @Transactional
    public AnswerResult submitAnswer(UUID userId, UUID groupId, UUID challengeId, UUID questionId, String answer) {
        GroupChallenge groupChallenge = groupChallengeRepository.findByGroupIdAndChallengeId(groupId, challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge in competition",
                        "groupId=" + groupId + ", challengeId=" + challengeId));
        ChallengeQuestion question = questionRepository.findByIdAndChallengeId(questionId, challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Question", questionId.toString()));

        if (questionCompletionRepository.existsByUserIdAndQuestionIdAndGroupChallengeId(
                userId, questionId, groupChallenge.getId())) {
            throw new DuplicateCompletionException("Question already completed");
        }

        boolean correct = answer != null && question.getAnswer() != null
                && answer.trim().equals(question.getAnswer().trim());
        if (!correct) {
            return AnswerResult.builder()
                    .groupChallengeId(groupChallenge.getId())
                    .correct(false)
                    .build();
        }

        try {
            questionCompletionRepository.saveAndFlush(QuestionCompletion.builder()
                    .userId(userId)
                    .question(question)
                    .groupChallenge(groupChallenge)
                    .pointsEarned(question.getPoints())
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateCompletionException("Question already completed");
        }

        UUID groupChallengeId = groupChallenge.getId();
        long solved = questionCompletionRepository.countByUserIdAndGroupChallengeId(userId, groupChallengeId);
        long total = questionRepository.countByChallengeId(challengeId);
        boolean challengeCompleted = false;
        int challengePoints = 0;

        if (solved >= total
                && !challengeCompletionRepository.existsByUserIdAndGroupChallengeId(userId, groupChallengeId)) {
            challengePoints = questionCompletionRepository
                    .sumPointsByUserIdAndGroupChallengeId(userId, groupChallengeId);
            saveChallengeCompletion(userId, groupChallenge, challengePoints);
            credit(userId, groupId, challengePoints);
            challengeCompleted = true;
            log.info("Challenge completed via questions: userId={}, groupChallengeId={}, points={}",
                    userId, groupChallengeId, challengePoints);
        }

        return AnswerResult.builder()
                .groupChallengeId(groupChallengeId)
                .correct(true)
                .questionPoints(question.getPoints())
                .challengeCompleted(challengeCompleted)
                .challengePoints(challengePoints)
                .totalPoints(pointsFor(userId, groupId))
                .build();
    }

    // ── Reset ────────────────────────────────────────────────────────────────

    /**
     * Removes the user's completions in the group and zeroes the balance, all or
     * nothing. Running it twice leaves the same state as running it once.
     * <p>
     * The balance row is locked before the deletes so a completion credited
     * concurrently either lands before the reset (and is removed with it) or
     * after it (and survives together with its points).
     */
    @Transactional
    public ResetSummary resetUserProgress(UUID userId, UUID groupId) {
        GroupPoints balance = groupPointsRepository.findByUserIdAndGroupIdForUpdate(userId, groupId).orElse(null);

        int questions = questionCompletionRepository.deleteByUserIdAndGroupId(userId, groupId);
        int challenges = challengeCompletionRepository.deleteByUserIdAndGroupId(userId, groupId);

        int previousPoints = 0;
        if (balance != null) {
            previousPoints = balance.getPoints();
            balance.setPoints(0);
            groupPointsRepository.save(balance);
        }

        log.info("Progress reset: userId={}, groupId={}, questionCompletions={}, challengeCompletions={}, "
                + "previousPoints={}", userId, groupId, questions, challenges, previousPoints);
        return ResetSummary.builder()
                .questionCompletionsRemoved(questions)
                .challengeCompletionsRemoved(challenges)
                .previousPoints(previousPoints)
                .build();
    }

    /** Deletes all progress of a group. Joins the caller's transaction. */
    @Transactional
    public void purgeGroup(UUID groupId) {
        questionCompletionRepository.deleteByGroupId(groupId);
        challengeCompletionRepository.deleteByGroupId(groupId);
        groupPointsRepository.deleteByGroupId(groupId);
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public int pointsFor(UUID userId, UUID groupId) {
        return groupPointsRepository.findPoints(userId, groupId).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<LeaderboardEntry> leaderboard(UUID groupId) {
        List<GroupPoints> balances = groupPointsRepository.findByGroupIdOrderByPointsDesc(groupId);
        Map<UUID, User> users = userRepository.findAllById(
                balances.stream().map(GroupPoints::getUserId).toList()).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));

        List<LeaderboardEntry> entries = new ArrayList<>();
        int rank = 0;
        int previous = Integer.MIN_VALUE;
        for (int i = 0; i < balances.size(); i++) {
            GroupPoints balance = balances.get(i);
            // Equal points share a rank
            if (balance.getPoints() != previous) {
                rank = i + 1;
                previous = balance.getPoints();
            }
            User user = users.get(balance.getUserId());
            entries.add(LeaderboardEntry.builder()
                    .rank(rank)
                    .userId(balance.getUserId())
                    .name(user != null ? user.getName() : null)
                    .points(balance.getPoints())
                    .build());
        }
        return entries;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void saveChallengeCompletion(UUID userId, GroupChallenge groupChallenge, int points) {
        try {
            challengeCompletionRepository.saveAndFlush(ChallengeCompletion.builder()
                    .userId(userId)
                    .groupChallenge(groupChallenge)
                    .pointsEarned(points)
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateCompletionException("Challenge already completed by this user");
        }
    }

    /**
     * Adds points with a single UPDATE. The first credit of a user in a group
     * inserts the balance row while holding the group row lock, so two first
     * credits never race on the unique (user, group) key.
     */
    private int credit(UUID userId, UUID groupId, int points) {
        if (groupPointsRepository.addPoints(userId, groupId, points) == 0) {
            CompetitionGroup group = groupRepository.findByIdForUpdate(groupId)
                    .orElseThrow(() -> new ResourceNotFoundException("CompetitionGroup", groupId.toString()));
            if (groupPointsRepository.addPoints(userId, groupId, points) == 0) {
                groupPointsRepository.saveAndFlush(GroupPoints.builder()
                        .userId(userId)
                        .group(group)
                        .points(points)
                        .build());
            }
        }
        return groupPointsRepository.findPoints(userId, groupId).orElse(points);
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    @Data
    @Builder
    public static class CompletionResult {
        private UUID groupId;
        private UUID challengeId;
        private int pointsEarned;
        private int totalPoints;
    }

    @Data
    @Builder
    public static class AnswerResult {
        private UUID groupChallengeId;
        private boolean correct;
        private int questionPoints;
        private boolean challengeCompleted;
        private int challengePoints;
        private int totalPoints;
    }

    @Data
    @Builder
    public static class ResetSummary {
        private int questionCompletionsRemoved;
        private int challengeCompletionsRemoved;
        private int previousPoints;
    }

    @Data
    @Builder
    public static class LeaderboardEntry {
        private int rank;
        private UUID userId;
        private String name;
        private int points;
    }
}
