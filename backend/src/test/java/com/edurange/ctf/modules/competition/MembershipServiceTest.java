package com.edurange.ctf.modules.competition;

import com.edurange.ctf.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MembershipServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private GroupMembershipRepository membershipRepository;

    @Mock
    private CompetitionGroupRepository groupRepository;

    private MembershipService membershipService;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        membershipService = new MembershipService(membershipRepository, groupRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void test_listForUser_partitionsByPhaseAndMergesRoles() {
        // given
        CompetitionGroup running = group("Running", NOW.minus(Duration.ofDays(1)), null);
        CompetitionGroup later = group("Later", NOW.plus(Duration.ofDays(3)), NOW.plus(Duration.ofDays(4)));
        CompetitionGroup soon = group("Soon", NOW.plus(Duration.ofDays(1)), null);
        CompetitionGroup oldest = group("Oldest", NOW.minus(Duration.ofDays(30)), NOW.minus(Duration.ofDays(29)));
        CompetitionGroup recent = group("Recent", NOW.minus(Duration.ofDays(5)), NOW);
        given(membershipRepository.findByUserIdWithGroup(userId)).willReturn(List.of(
                membership(running, MembershipRole.MEMBER),
                membership(running, MembershipRole.INSTRUCTOR),
                membership(later, MembershipRole.MEMBER),
                membership(soon, MembershipRole.MEMBER),
                membership(oldest, MembershipRole.MEMBER),
                membership(recent, MembershipRole.MEMBER)));

        // when
        MembershipService.MyCompetitions mine = membershipService.listForUser(userId);

        // then
        assertThat(mine.getActive()).extracting(MembershipService.CompetitionSummary::getName)
                .containsExactly("Running");
        assertThat(mine.getActive().get(0).getRoles())
                .containsExactlyInAnyOrder(MembershipRole.MEMBER, MembershipRole.INSTRUCTOR);
        assertThat(mine.getUpcoming()).extracting(MembershipService.CompetitionSummary::getName)
                .containsExactly("Soon", "Later");
        // end date equal to now counts as ended
        assertThat(mine.getCompleted()).extracting(MembershipService.CompetitionSummary::getName)
                .containsExactly("Recent", "Oldest");
    }

    @Test
    void test_listForUser_noMemberships_returnsEmptyLists() {
        given(membershipRepository.findByUserIdWithGroup(userId)).willReturn(List.of());

        MembershipService.MyCompetitions mine = membershipService.listForUser(userId);

        assertThat(mine.getActive()).isEmpty();
        assertThat(mine.getUpcoming()).isEmpty();
        assertThat(mine.getCompleted()).isEmpty();
    }

    @Test
    void test_addMember_existingRole_returnsExistingWithoutSaving() {
        CompetitionGroup group = group("Running", NOW.minus(Duration.ofDays(1)), null);
        GroupMembership existing = membership(group, MembershipRole.MEMBER);
        given(membershipRepository.findByGroupIdAndUserIdAndRole(group.getId(), userId, MembershipRole.MEMBER))
                .willReturn(Optional.of(existing));

        GroupMembership result = membershipService.addMember(group.getId(), userId, MembershipRole.MEMBER);

        assertThat(result).isSameAs(existing);
        verify(membershipRepository, never()).save(any());
    }

    @Test
    void test_addMember_unknownGroup_throwsNotFound() {
        UUID groupId = UUID.randomUUID();
        given(membershipRepository.findByGroupIdAndUserIdAndRole(groupId, userId, MembershipRole.MEMBER))
                .willReturn(Optional.empty());
        given(groupRepository.findById(groupId)).willReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> membershipService.addMember(groupId, userId, MembershipRole.MEMBER));
    }

    @Test
    void test_removeMember_notAMember_throwsNotFound() {
        UUID groupId = UUID.randomUUID();
        given(membershipRepository.findByGroupIdAndUserIdAndRole(groupId, userId, MembershipRole.MEMBER))
                .willReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> membershipService.removeMember(groupId, userId));
        verify(membershipRepository, never()).delete(any());
    }

    private CompetitionGroup group(String name, Instant start, Instant end) {
        return CompetitionGroup.builder()
                .id(UUID.randomUUID())
                .name(name)
                .startDate(start)
                .endDate(end)
                .createdBy(UUID.randomUUID())
                .build();
    }

    private GroupMembership membership(CompetitionGroup group, MembershipRole role) {
        return GroupMembership.builder()
                .id(UUID.randomUUID())
                .group(group)
                .userId(userId)
                .role(role)
                .build();
    }
}
