package com.volunteermedia.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Fixed-window request counter in Redis ({@code INCR} + {@code EXPIRE}).
 *
 * Shared by all instances behind the load balancer. Fails open: if Redis is down,
 * requests are let through and the error is logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimitService {

    private static final String RATE_LIMIT_PREFIX = "ratelimit:";

    private final StringRedisTemplate redisTemplate;

    /**
     * Count one request for {@code key} and report whether the window's budget is exhausted.
     */
    public boolean isLimited(String key, int maxRequests, Duration window) {
        String redisKey = RATE_LIMIT_PREFIX + key;
        try {
            Long count = redisTemplate.opsForValue().increment(redisKey);
            if (count == null) {
                return false;
            }
            if (count == 1L) {
                redisTemplate.expire(redisKey, window);
            }
            return count > maxRequests;
        } catch (Exception e) {
            log.error("Redis error in rate limiter, allowing request: {}", key, e);
            return false;
        }
    }
}
