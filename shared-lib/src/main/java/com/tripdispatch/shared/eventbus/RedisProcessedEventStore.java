package com.tripdispatch.shared.eventbus;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Redis-backed store shared by every instance of a consumer group.
 *
 * Key pattern:  events:processed:{consumer}:{eventId}
 * Value:        "1", expiring after the dedup TTL (24h by default)
 */
@Slf4j
public class RedisProcessedEventStore implements ProcessedEventStore {

    private static final String KEY_PREFIX = "events:processed:";

    private final RedisTemplate<String, String> redisTemplate;
    private final Duration ttl;

    public RedisProcessedEventStore(RedisTemplate<String, String> redisTemplate, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public boolean isProcessed(String consumer, String eventId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + consumer + ":" + eventId));
    }

    @Override
    public void markProcessed(String consumer, String eventId) {
        redisTemplate.opsForValue().set(KEY_PREFIX + consumer + ":" + eventId, "1", ttl);
        log.debug("Marked event {} processed for {}", eventId, consumer);
    }
}
