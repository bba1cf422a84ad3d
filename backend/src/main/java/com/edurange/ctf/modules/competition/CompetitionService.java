package com.edurange.ctf.modules.competition;

import com.edurange.ctf.exception.BusinessException;
import com.edurange.ctf.exception.ResourceNotFoundException;
import com.edurange.ctf.modules.accesscode.AccessCodeService;
import com.edurange.ctf.modules.challenge.Challenge;
import com.edurange.ctf.modules.challenge.ChallengeRepository;
import com.edurange.ctf.modules.competition.dto.CompetitionDto;
import com.edurange.ctf.modules.competition.dto.CreateCompetitionRequest;
import com.edurange.ctf.modules.progress.ProgressService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CompetitionService {

    private final CompetitionGroupRepository groupRepository;
    private final GroupChallengeRepository groupChallengeRepository;
    private final GroupMembershipRepository membershipRepository;
    private final ChallengeRepository challengeRepository;
    private final MembershipService membershipService;
    private final AccessCodeService accessCodeService;
    private final ProgressService progressService;
    private final Clock clock;

    @Transactional
    public CompetitionDto createCompetition(CreateCompetitionRequest request, UUID creatorId) {
        if (request.getEndDate() != null && request.getEndDate().isBefore(request.getStartDate())) {
            throw new BusinessException("End date must not be before start date");
        }

        CompetitionGroup group = groupRepository.save(CompetitionGroup.builder()
                .name(request.getName())
                .description(request.getDescription())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .createdBy(creatorId)
                .build());

        Set<UUID> instructors = new LinkedHashSet<>();
        instructors.add(creatorId);
        if (request.getInstructorIds() != null) {
            instructors.addAll(request.getInstructorIds());
        }
        for (UUID instructorId : instructors) {
            membershipService.addMember(group.getId(), instructorId, MembershipRole.INSTRUCTOR);
        }

        Set<UUID> seenChallenges = new HashSet<>();
        for (CreateCompetitionRequest.ChallengeAssignment assignment : request.getChallenges()) {
            if (!seenChallenges.add(assignment.getChallengeId())) {
                throw new BusinessException("Challenge listed twice: " + assignment.getChallengeId());
            }
            Challenge challenge = challengeRepository.findById(assignment.getChallengeId())
                    .orElseThrow(() -> new ResourceNotFoundException("Challenge",
                            assignment.getChallengeId().toString()));
            groupChallengeRepository.save(GroupChallenge.builder()
                    .group(group)
                    .challenge(challenge)
                    .points(assignment.getPoints())
                    .build());
        }

        log.info("Competition created: groupId={}, createdBy={}, instructors={}, challenges={}",
                group.getId(), creatorId, instructors.size(), seenChallenges.size());
        return toDto(group);
    }

    @Transactional(readOnly = true)
    public CompetitionDto getCompetition(UUID groupId) {
        return toDto(findGroup(groupId));
    }

    @Transactional(readOnly = true)
    public CompetitionGroup findGroup(UUID groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Competition", groupId.toString()));
    }

    @Transactional(readOnly = true)
    public GroupChallenge findGroupChallenge(UUID groupId, UUID challengeId) {
        return groupChallengeRepository.findByGroupIdAndChallengeId(groupId, challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge in competition",
                        "groupId=" + groupId + ", challengeId=" + challengeId));
    }

    @Transactional(readOnly = true)
    public List<CompetitionGroup> findEndedCompetitions() {
        return groupRepository.findByEndDateIsNotNullAndEndDateLessThanEqual(clock.instant());
    }

    /**
     * Removes the group together with everything it owns. Live instances must be
     * stopped by the caller beforehand.
     */
    @Transactional
    public void deleteCompetition(UUID groupId) {
        CompetitionGroup group = findGroup(groupId);
        int codes = accessCodeService.purgeGroup(groupId);
        progressService.purgeGroup(groupId);
        int challenges = groupChallengeRepository.deleteByGroupId(groupId);
        int members = membershipRepository.deleteByGroupId(groupId);
        groupRepository.delete(group);
        log.info("Competition deleted: groupId={}, accessCodes={}, challenges={}, memberships={}",
                groupId, codes, challenges, members);
    }

    private CompetitionDto toDto(CompetitionGroup group) {
        List<CompetitionDto.ChallengeEntry> challenges = groupChallengeRepository
                .findByGroupIdWithChallenge(group.getId()).stream()
                .map(gc -> CompetitionDto.ChallengeEntry.builder()
                        .groupChallengeId(gc.getId())
                        .challengeId(gc.getChallenge().getId())
                        .name(gc.getChallenge().getName())
                        .challengeType(gc.getChallenge().getChallengeType().wireName())
                        .points(gc.getPoints())
                        .build())
                .toList();

        return CompetitionDto.builder()
                .id(group.getId())
                .name(group.getName())
                .description(group.getDescription())
                .startDate(group.getStartDate())
                .endDate(group.getEndDate())
                .phase(group.phaseAt(clock.instant()))
                .createdBy(group.getCreatedBy())
                .createdAt(group.getCreatedAt())
                .instructorIds(membershipService.instructorIds(group.getId()))
                .challenges(challenges)
                .build();
    }
}
