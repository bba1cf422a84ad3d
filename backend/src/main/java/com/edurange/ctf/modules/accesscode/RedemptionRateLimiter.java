package com.edurange.ctf.modules.accesscode;

import com.edurange.ctf.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window limit on access code redemption attempts per user, kept in Redis.
 * A user who exceeds the window is blocked for {@code blockSeconds}. Redis
 * failures let the attempt through.
 */
@Slf4j
@Component
public class RedemptionRateLimiter {

    private static final String COUNTER_PREFIX = "ratelimit:redeem:";
    private static final String BLOCK_SUFFIX = ":block";

    private final RedisTemplate<String, String> redisTemplate;
    private final int maxAttempts;
    private final long windowSeconds;
    private final long blockSeconds;

    public RedemptionRateLimiter(RedisTemplate<String, String> redisTemplate,
            @Value("${lifecycle.access-codes.rate-limit.max-attempts:15}") int maxAttempts,
            @Value("${lifecycle.access-codes.rate-limit.window-seconds:60}") long windowSeconds,
            @Value("${lifecycle.access-codes.rate-limit.block-seconds:120}") long blockSeconds) {
        this.redisTemplate = redisTemplate;
        this.maxAttempts = maxAttempts;
        this.windowSeconds = windowSeconds;
        this.blockSeconds = blockSeconds;
    }

    public void consume(UUID userId) {
        String counterKey = COUNTER_PREFIX + userId;
        String blockKey = counterKey + BLOCK_SUFFIX;
        boolean exceeded;
        try {
            if (Boolean.TRUE.equals(redisTemplate.hasKey(blockKey))) {
                exceeded = true;
            } else {
                Long attempts = redisTemplate.opsForValue().increment(counterKey);
                if (attempts != null && attempts == 1L) {
                    redisTemplate.expire(counterKey, windowSeconds, TimeUnit.SECONDS);
                }
                exceeded = attempts != null && attempts > maxAttempts;
                if (exceeded) {
                    redisTemplate.opsForValue().set(blockKey, "1", blockSeconds, TimeUnit.SECONDS);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Redemption rate limiter unavailable for userId={}: {}", userId, e.getMessage());
            return;
        }

        if (exceeded) {
            log.warn("Redemption rate limit exceeded: userId={}", userId);
            throw new RateLimitExceededException("Too many access code attempts. Try again later.");
        }
    }
}
