package com.volunteermedia.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-based de-duplication for notification consumers.
 *
 * Kafka delivers at least once, and the outbox publisher may resend after a crash
 * between "sent" and "marked published". Without this check a volunteer could get the
 * same announcement email twice.
 *
 * KEY NAMING:
 * ===========
 * idempotency:{eventType}:{eventId}:{consumer}
 * e.g. idempotency:AnnouncementPublished:3f2c...:email
 *
 * The consumer name is part of the key so the email and GroupMe fan-outs of the
 * same event are tracked independently.
 *
 * FAILOVER:
 * =========
 * If Redis is unreachable the event is treated as new (fail open). A rare duplicate
 * notification is preferable to a lost one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private final StringRedisTemplate redisTemplate;

    private static final Duration IDEMPOTENCY_TTL = Duration.ofDays(7);
    private static final String IDEMPOTENCY_PREFIX = "idempotency:";

    /**
     * Atomically claim an event for a consumer ({@code SET key value NX EX ttl}).
     *
     * @return true if this is the first time the consumer sees the event, false for a duplicate
     */
    public boolean tryAcquire(String eventType, String eventId, String consumerName) {
        String key = buildKey(eventType, eventId, consumerName);

        try {
            Boolean acquired = redisTemplate.opsForValue()
                    .setIfAbsent(key, String.valueOf(System.currentTimeMillis()), IDEMPOTENCY_TTL);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Claimed event {}:{} for {}", eventType, eventId, consumerName);
                return true;
            }
            log.warn("Event already processed, skipping: {}:{} ({})", eventType, eventId, consumerName);
            return false;

        } catch (Exception e) {
            log.error("Redis error during idempotency check, processing anyway: {}:{}", eventType, eventId, e);
            return true;
        }
    }

    /**
     * Drop a claim so a redelivery is processed again. Used when processing fails after the claim.
     */
    public void release(String eventType, String eventId, String consumerName) {
        try {
            redisTemplate.delete(buildKey(eventType, eventId, consumerName));
        } catch (Exception e) {
            log.error("Redis error releasing idempotency key: {}:{}", eventType, eventId, e);
        }
    }

    private String buildKey(String eventType, String eventId, String consumerName) {
        return IDEMPOTENCY_PREFIX + eventType + ":" + eventId + ":" + consumerName;
    }
}
