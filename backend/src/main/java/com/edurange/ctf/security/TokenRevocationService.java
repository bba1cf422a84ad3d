package com.edurange.ctf.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Revoked access-token ids, shared with the identity service through Redis.
 * A Redis outage is treated as "not revoked" so authentication keeps working.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenRevocationService {

    private static final String BLACKLIST_PREFIX = "blacklist:jwt:";

    private final RedisTemplate<String, String> redisTemplate;

    public boolean isRevoked(String jti) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(BLACKLIST_PREFIX + jti));
        } catch (RuntimeException e) {
            log.warn("Token revocation lookup failed for jti={}: {}", jti, e.getMessage());
            return false;
        }
    }
}
