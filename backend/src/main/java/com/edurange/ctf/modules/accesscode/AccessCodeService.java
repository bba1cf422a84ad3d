package com.edurange.ctf.modules.accesscode;

import com.edurange.ctf.exception.BusinessException;
import com.edurange.ctf.exception.CodeAlreadyConsumedException;
import com.edurange.ctf.exception.CodeExpiredException;
import com.edurange.ctf.exception.CodeNotFoundException;
import com.edurange.ctf.exception.InternalInconsistencyException;
import com.edurange.ctf.exception.ResourceNotFoundException;
import com.edurange.ctf.modules.accesscode.dto.AccessCodeDto;
import com.edurange.ctf.modules.accesscode.dto.RedemptionResult;
import com.edurange.ctf.modules.audit.AuditEventType;
import com.edurange.ctf.modules.audit.AuditLogService;
import com.edurange.ctf.modules.competition.CompetitionGroup;
import com.edurange.ctf.modules.competition.CompetitionGroupRepository;
import com.edurange.ctf.modules.competition.MembershipRole;
import com.edurange.ctf.modules.competition.MembershipService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Issues and redeems competition access codes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessCodeService {

    static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int CODE_LENGTH = 8;
    private static final int MAX_GENERATION_ATTEMPTS = 10;

    private final AccessCodeRepository accessCodeRepository;
    private final AccessCodeRedemptionRepository redemptionRepository;
    private final CompetitionGroupRepository groupRepository;
    private final MembershipService membershipService;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Transactional
    public AccessCodeDto issue(UUID groupId, UUID createdBy, Duration ttl, MembershipRole grantRole,
            Integer maxUses) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new BusinessException("Access code lifetime must be positive");
        }
        if (maxUses != null && maxUses < 1) {
            throw new BusinessException("maxUses must be at least 1");
        }
        CompetitionGroup group = groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Competition", groupId.toString()));

        Instant now = clock.instant();
        AccessCode code = accessCodeRepository.save(AccessCode.builder()
                .code(generateUniqueCode())
                .group(group)
                .createdBy(createdBy)
                .expiresAt(now.plus(ttl))
                .grantRole(grantRole == null ? MembershipRole.MEMBER : grantRole)
                .maxUses(maxUses)
                .usedCount(0)
                .build());

        log.info("Access code issued: id={}, groupId={}, grantRole={}, maxUses={}, expiresAt={}",
                code.getId(), groupId, code.getGrantRole(), maxUses, code.getExpiresAt());
        return AccessCodeDto.from(code, now);
    }

    /**
     * Redeems {@code rawCode} for {@code userId} under a row lock on the code.
     * A user redeeming the same code again gets the grant re-applied and
     * {@code repeat=true}; an expired code never grants anything.
     */
    @Transactional
    public RedemptionResult redeem(String rawCode, UUID userId) {
        String code = normalize(rawCode);
        AccessCode accessCode = accessCodeRepository.findByCodeForUpdate(code)
                .orElseThrow(() -> new CodeNotFoundException(code));

        Instant now = clock.instant();
        if (accessCode.isExpiredAt(now)) {
            throw new CodeExpiredException(code, accessCode.getExpiresAt());
        }

        boolean repeat = redemptionRepository.existsByAccessCodeIdAndUserId(accessCode.getId(), userId);
        if (!repeat) {
            if (accessCode.isExhausted()) {
                throw new CodeAlreadyConsumedException(code, accessCode.getMaxUses());
            }
            redemptionRepository.save(AccessCodeRedemption.builder()
                    .accessCode(accessCode)
                    .userId(userId)
                    .build());
            accessCode.setUsedCount(accessCode.getUsedCount() + 1);
            accessCodeRepository.save(accessCode);
        }

        CompetitionGroup group = accessCode.getGroup();
        membershipService.addMember(group.getId(), userId, accessCode.getGrantRole());

        log.info("Access code redeemed: codeId={}, userId={}, groupId={}, repeat={}",
                accessCode.getId(), userId, group.getId(), repeat);
        return RedemptionResult.builder()
                .accessCodeId(accessCode.getId())
                .groupId(group.getId())
                .groupName(group.getName())
                .grantRole(accessCode.getGrantRole())
                .repeat(repeat)
                .build();
    }

    /**
     * Marks every code past its expiry exactly once and records one
     * {@code ACCESS_CODE_EXPIRED} event per code. Each claim commits on its own,
     * so concurrent or repeated sweeps never emit a second event for a code.
     *
     * @return number of codes this run claimed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        List<AccessCode> candidates = accessCodeRepository.findExpiredUnprocessed(now);
        int claimed = 0;
        for (AccessCode code : candidates) {
            if (accessCodeRepository.claimExpiry(code.getId(), now) != 1) {
                log.debug("Access code {} already claimed by another sweep", code.getId());
                continue;
            }
            claimed++;
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("code", code.getCode());
            metadata.put("expiresAt", code.getExpiresAt().toString());
            metadata.put("usedCount", code.getUsedCount());
            auditLogService.append(AuditEventType.ACCESS_CODE_EXPIRED, null, code.getId().toString(),
                    code.getGroup().getId(), metadata);
        }
        if (claimed > 0) {
            log.info("Access code sweep: {} of {} candidates marked expired", claimed, candidates.size());
        }
        return claimed;
    }

    @Transactional(readOnly = true)
    public List<AccessCodeDto> listForGroup(UUID groupId) {
        Instant now = clock.instant();
        return accessCodeRepository.findByGroupIdOrderByCreatedAtDesc(groupId).stream()
                .map(code -> AccessCodeDto.from(code, now))
                .toList();
    }

    @Transactional
    public AccessCodeDto revoke(UUID groupId, UUID codeId) {
        AccessCode code = accessCodeRepository.findByIdAndGroupId(codeId, groupId)
                .orElseThrow(() -> new ResourceNotFoundException("AccessCode", codeId.toString()));
        AccessCodeDto snapshot = AccessCodeDto.from(code, clock.instant());
        redemptionRepository.deleteByAccessCodeId(codeId);
        accessCodeRepository.delete(code);
        log.info("Access code revoked: id={}, groupId={}", codeId, groupId);
        return snapshot;
    }

    /** Deletes all codes of a group with their redemptions. Joins the caller's transaction. */
    @Transactional
    public int purgeGroup(UUID groupId) {
        redemptionRepository.deleteByGroupId(groupId);
        return accessCodeRepository.deleteByGroupId(groupId);
    }

    static String normalize(String rawCode) {
        return rawCode == null ? "" : rawCode.trim().toUpperCase(Locale.ROOT);
    }

    private String generateUniqueCode() {
        for (int attempt = 0; attempt < MAX_GENERATION_ATTEMPTS; attempt++) {
            String candidate = randomCode();
            if (!accessCodeRepository.existsByCode(candidate)) {
                return candidate;
            }
            log.debug("Access code collision on attempt {}", attempt + 1);
        }
        throw new InternalInconsistencyException(
                "Could not generate a unique access code after " + MAX_GENERATION_ATTEMPTS + " attempts");
    }

    private String randomCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }
}
