package com.edurange.ctf.modules.competition;

import com.edurange.ctf.exception.ResourceNotFoundException;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Who belongs to which competition, and in what role.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipService {

    private final GroupMembershipRepository membershipRepository;
    private final CompetitionGroupRepository groupRepository;
    private final Clock clock;

    /**
     * Grants {@code role} in the group. Returns the existing relation when the
     * user already holds that role.
     */
    @Transactional
    public GroupMembership addMember(UUID groupId, UUID userId, MembershipRole role) {
        return membershipRepository.findByGroupIdAndUserIdAndRole(groupId, userId, role)
                .orElseGet(() -> {
                    CompetitionGroup group = groupRepository.findById(groupId)
                            .orElseThrow(() -> new ResourceNotFoundException("Competition", groupId.toString()));
                    GroupMembership saved = membershipRepository.save(GroupMembership.builder()
                            .group(group)
                            .userId(userId)
                            .role(role)
                            .build());
                    log.info("Membership granted: groupId={}, userId={}, role={}", groupId, userId, role);
                    return saved;
                });
    }

    @Transactional
    public void removeMember(UUID groupId, UUID userId) {
        GroupMembership membership = membershipRepository
                .findByGroupIdAndUserIdAndRole(groupId, userId, MembershipRole.MEMBER)
                .orElseThrow(() -> new ResourceNotFoundException("Membership",
                        "groupId=" + groupId + ", userId=" + userId));
        membershipRepository.delete(membership);
        log.info("Membership removed: groupId={}, userId={}", groupId, userId);
    }

    @Transactional(readOnly = true)
    public boolean isInstructor(UUID userId, UUID groupId) {
        return membershipRepository.existsByGroupIdAndUserIdAndRole(groupId, userId, MembershipRole.INSTRUCTOR);
    }

    /** Member or instructor. */
    @Transactional(readOnly = true)
    public boolean isParticipant(UUID userId, UUID groupId) {
        return membershipRepository.existsByGroupIdAndUserId(groupId, userId);
    }

    @Transactional(readOnly = true)
    public List<UUID> instructorIds(UUID groupId) {
        return membershipRepository.findByGroupIdAndRole(groupId, MembershipRole.INSTRUCTOR).stream()
                .map(GroupMembership::getUserId)
                .toList();
    }

    /**
     * Competitions the user belongs to, split by phase at the current instant.
     * A user holding two roles in one group sees the group once.
     */
    @Transactional(readOnly = true)
    public MyCompetitions listForUser(UUID userId) {
        Instant now = clock.instant();
        Map<UUID, CompetitionSummary> byGroup = new LinkedHashMap<>();

        for (GroupMembership membership : membershipRepository.findByUserIdWithGroup(userId)) {
            CompetitionGroup group = membership.getGroup();
            CompetitionSummary summary = byGroup.computeIfAbsent(group.getId(), id -> CompetitionSummary.builder()
                    .id(id)
                    .name(group.getName())
                    .description(group.getDescription())
                    .startDate(group.getStartDate())
                    .endDate(group.getEndDate())
                    .phase(group.phaseAt(now))
                    .roles(EnumSet.noneOf(MembershipRole.class))
                    .build());
            summary.getRoles().add(membership.getRole());
        }

        List<CompetitionSummary> active = new ArrayList<>();
        List<CompetitionSummary> upcoming = new ArrayList<>();
        List<CompetitionSummary> completed = new ArrayList<>();
        for (CompetitionSummary summary : byGroup.values()) {
            switch (summary.getPhase()) {
                case UPCOMING -> upcoming.add(summary);
                case COMPLETED -> completed.add(summary);
                default -> active.add(summary);
            }
        }
        Comparator<CompetitionSummary> byStart = Comparator.comparing(CompetitionSummary::getStartDate);
        active.sort(byStart);
        upcoming.sort(byStart);
        completed.sort(byStart.reversed());

        return MyCompetitions.builder()
                .active(active)
                .upcoming(upcoming)
                .completed(completed)
                .build();
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    @Data
    @Builder
    public static class MyCompetitions {
        private List<CompetitionSummary> active;
        private List<CompetitionSummary> upcoming;
        private List<CompetitionSummary> completed;
    }

    @Data
    @Builder
    public static class CompetitionSummary {
        private UUID id;
        private String name;
        private String description;
        private Instant startDate;
        private Instant endDate;
        private CompetitionGroup.Phase phase;
        private Set<MembershipRole> roles;
    }
}
