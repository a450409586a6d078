package com.vaultsphere.auth.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static com.vaultsphere.auth.domain.constants.AuthConstants.REDIS_RATE_LIMIT_PREFIX;

/**
 * Fixed-window request counter per client key, shared by all instances through Redis.
 * INCR and the first PEXPIRE run in one Lua script so a counter can never outlive its window.
 */
@Slf4j
public class RedisRateLimiter {

    private static final RedisScript<List> FIXED_WINDOW_SCRIPT = new DefaultRedisScript<>("""
            local current = redis.call('INCR', KEYS[1])
            if current == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            local ttl = redis.call('PTTL', KEYS[1])
            return {current, ttl}
            """, List.class);

    private final StringRedisTemplate redisTemplate;
    private final int maxRequests;
    private final Duration window;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, int maxRequests, Duration window) {
        this.redisTemplate = redisTemplate;
        this.maxRequests = maxRequests;
        this.window = window;
        log.info("[RATE_LIMIT_INIT] Auth rate limiter ready | maxRequests={} | window={}s",
                maxRequests, window.toSeconds());
    }

    /**
     * Counts this request against the client's current window.
     * Redis failures propagate; the caller decides whether to fail open.
     */
    public RateLimitResult tryAcquire(String clientKey) {
        List<?> response = redisTemplate.execute(FIXED_WINDOW_SCRIPT,
                List.of(REDIS_RATE_LIMIT_PREFIX + clientKey),
                String.valueOf(window.toMillis()));

        if (response == null || response.size() < 2) {
            return new RateLimitResult(true, maxRequests, 0);
        }

        long count = ((Number) response.get(0)).longValue();
        long ttlMillis = ((Number) response.get(1)).longValue();
        long retryAfterSeconds = ttlMillis > 0 ? Math.max(1, (ttlMillis + 999) / 1000) : window.toSeconds();

        return new RateLimitResult(count <= maxRequests, (int) Math.max(0, maxRequests - count), retryAfterSeconds);
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public static class RateLimitResult {
        private final boolean allowed;
        private final int remaining;
        private final long retryAfterSeconds;

        public RateLimitResult(boolean allowed, int remaining, long retryAfterSeconds) {
            this.allowed = allowed;
            this.remaining = remaining;
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public boolean isAllowed() { return allowed; }
        public int getRemaining() { return remaining; }
        public long getRetryAfterSeconds() { return retryAfterSeconds; }
    }
}
