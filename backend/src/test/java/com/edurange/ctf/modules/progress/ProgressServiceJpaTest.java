package com.edurange.ctf.modules.progress;

import com.edurange.ctf.exception.DuplicateCompletionException;
import com.edurange.ctf.modules.challenge.Challenge;
import com.edurange.ctf.modules.challenge.ChallengeQuestion;
import com.edurange.ctf.modules.competition.CompetitionGroup;
import com.edurange.ctf.modules.competition.GroupChallenge;
import com.edurange.ctf.modules.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(ProgressService.class)
class ProgressServiceJpaTest {

    @Autowired
    private ProgressService progressService;

    @Autowired
    private ChallengeCompletionRepository challengeCompletionRepository;

    @Autowired
    private QuestionCompletionRepository questionCompletionRepository;

    @Autowired
    private TestEntityManager entityManager;

    private final UUID userId = UUID.randomUUID();
    private CompetitionGroup group;
    private Challenge challenge;
    private GroupChallenge groupChallenge;
    private ChallengeQuestion first;
    private ChallengeQuestion second;

    @BeforeEach
    void setUp() {
        group = entityManager.persist(CompetitionGroup.builder()
                .name("Spring CTF")
                .startDate(Instant.now().minus(1, ChronoUnit.DAYS))
                .createdBy(UUID.randomUUID())
                .build());
        challenge = entityManager.persist(Challenge.builder()
                .name("Treasure Hunt")
                .challengeImage("registry.local/treasure-hunt:1")
                .challengeType(Challenge.ChallengeType.FULLOS)
                .build());
        first = entityManager.persist(ChallengeQuestion.builder()
                .challenge(challenge).prompt("First flag?").answer("flag{one}").points(10).position(1).build());
        second = entityManager.persist(ChallengeQuestion.builder()
                .challenge(challenge).prompt("Second flag?").answer("flag{two}").points(20).position(2).build());
        groupChallenge = entityManager.persist(GroupChallenge.builder()
                .group(group).challenge(challenge).points(50).build());
        entityManager.flush();
    }

    @Test
    @DisplayName("solving every question completes the challenge and credits the summed points")
    void submitAnswer_allQuestionsSolved_completesChallenge() {
        ProgressService.AnswerResult partial = progressService.submitAnswer(userId, group.getId(), challenge.getId(),
                first.getId(), " flag{one} ");
        assertThat(partial.isCorrect()).isTrue();
        assertThat(partial.isChallengeCompleted()).isFalse();
        assertThat(partial.getTotalPoints()).isZero();

        ProgressService.AnswerResult done = progressService.submitAnswer(userId, group.getId(), challenge.getId(),
                second.getId(), "flag{two}");
        assertThat(done.isChallengeCompleted()).isTrue();
        assertThat(done.getChallengePoints()).isEqualTo(30);
        assertThat(done.getTotalPoints()).isEqualTo(30);
        assertThat(challengeCompletionRepository.existsByUserIdAndGroupChallengeId(userId, groupChallenge.getId()))
                .isTrue();
    }

    @Test
    @DisplayName("a wrong answer records nothing")
    void submitAnswer_wrongAnswer_recordsNothing() {
        ProgressService.AnswerResult result = progressService.submitAnswer(userId, group.getId(), challenge.getId(),
                first.getId(), "flag{nope}");

        assertThat(result.isCorrect()).isFalse();
        assertThat(questionCompletionRepository.countByUserIdAndGroupChallengeId(userId, groupChallenge.getId()))
                .isZero();
    }

    @Test
    @DisplayName("a second completion of the same challenge is rejected and the balance is unchanged")
    void recordCompletion_twice_rejectsSecond() {
        ProgressService.CompletionResult result = progressService.recordCompletion(userId, groupChallenge.getId());
        assertThat(result.getTotalPoints()).isEqualTo(50);

        assertThrows(DuplicateCompletionException.class,
                () -> progressService.recordCompletion(userId, groupChallenge.getId()));
        assertThat(progressService.pointsFor(userId, group.getId())).isEqualTo(50);
    }

    @Test
    @DisplayName("the completion table refuses a duplicate row")
    void challengeCompletion_duplicateRow_violatesConstraint() {
        challengeCompletionRepository.saveAndFlush(ChallengeCompletion.builder()
                .userId(userId).groupChallenge(groupChallenge).pointsEarned(50).build());

        assertThrows(DataIntegrityViolationException.class,
                () -> challengeCompletionRepository.saveAndFlush(ChallengeCompletion.builder()
                        .userId(userId).groupChallenge(groupChallenge).pointsEarned(50).build()));
    }

    @Test
    @DisplayName("reset removes completions, zeroes points and is idempotent")
    void resetUserProgress_twice_sameEndState() {
        // given
        CompetitionGroup otherGroup = entityManager.persist(CompetitionGroup.builder()
                .name("Autumn CTF")
                .startDate(Instant.now().minus(1, ChronoUnit.DAYS))
                .createdBy(UUID.randomUUID())
                .build());
        GroupChallenge otherGroupChallenge = entityManager.persist(GroupChallenge.builder()
                .group(otherGroup).challenge(challenge).points(40).build());
        entityManager.flush();
        progressService.submitAnswer(userId, group.getId(), challenge.getId(), first.getId(), "flag{one}");
        progressService.submitAnswer(userId, group.getId(), challenge.getId(), second.getId(), "flag{two}");
        progressService.submitAnswer(userId, otherGroup.getId(), challenge.getId(), first.getId(), "flag{one}");
        progressService.recordCompletion(userId, otherGroupChallenge.getId());
        UUID otherUser = UUID.randomUUID();
        progressService.recordCompletion(otherUser, groupChallenge.getId());
        entityManager.flush();

        // when
        ProgressService.ResetSummary summary = progressService.resetUserProgress(userId, group.getId());
        entityManager.flush();
        entityManager.clear();
        ProgressService.ResetSummary again = progressService.resetUserProgress(userId, group.getId());

        // then
        assertThat(summary.getQuestionCompletionsRemoved()).isEqualTo(2);
        assertThat(summary.getChallengeCompletionsRemoved()).isEqualTo(1);
        assertThat(summary.getPreviousPoints()).isEqualTo(30);
        assertThat(again.getQuestionCompletionsRemoved()).isZero();
        assertThat(again.getChallengeCompletionsRemoved()).isZero();
        assertThat(again.getPreviousPoints()).isZero();
        assertThat(progressService.pointsFor(userId, group.getId())).isZero();
        assertThat(challengeCompletionRepository.findByUserIdAndGroupId(userId, group.getId())).isEmpty();
        // other users keep their progress
        assertThat(progressService.pointsFor(otherUser, group.getId())).isEqualTo(50);
        // the user's progress in other competitions is untouched
        assertThat(progressService.pointsFor(userId, otherGroup.getId())).isEqualTo(40);
        assertThat(challengeCompletionRepository.findByUserIdAndGroupId(userId, otherGroup.getId())).hasSize(1);
        assertThat(questionCompletionRepository.countByUserIdAndGroupChallengeId(userId, otherGroupChallenge.getId()))
                .isEqualTo(1);
    }

    @Test
    @DisplayName("leaderboard ranks by points and shares ranks on ties")
    void leaderboard_tiesShareRank() {
        User alice = persistUser("Alice");
        User bob = persistUser("Bob");
        User carol = persistUser("Carol");
        progressService.recordCompletion(alice.getId(), groupChallenge.getId());
        progressService.recordCompletion(bob.getId(), groupChallenge.getId());
        progressService.submitAnswer(carol.getId(), group.getId(), challenge.getId(), first.getId(), "flag{one}");
        progressService.submitAnswer(carol.getId(), group.getId(), challenge.getId(), second.getId(), "flag{two}");

        List<ProgressService.LeaderboardEntry> board = progressService.leaderboard(group.getId());

        assertThat(board).hasSize(3);
        assertThat(board.get(0).getRank()).isEqualTo(1);
        assertThat(board.get(1).getRank()).isEqualTo(1);
        assertThat(board.get(2).getRank()).isEqualTo(3);
        assertThat(board.get(2).getName()).isEqualTo("Carol");
        assertThat(board.get(2).getPoints()).isEqualTo(30);
    }

    private User persistUser(String name) {
        return entityManager.persist(User.builder()
                .id(UUID.randomUUID())
                .name(name)
                .email(name.toLowerCase() + "@ctf.local")
                .build());
    }
}
