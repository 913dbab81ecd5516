package com.tripdispatch.shared.eventbus;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store; entries expire after the configured TTL and are purged lazily on write.
 */
public class InMemoryProcessedEventStore implements ProcessedEventStore {

    private final ConcurrentMap<String, Instant> processed = new ConcurrentHashMap<>();
    private final Duration ttl;

    public InMemoryProcessedEventStore(Duration ttl) {
        this.ttl = ttl;
    }

    @Override
    public boolean isProcessed(String consumer, String eventId) {
        Instant expiresAt = processed.get(key(consumer, eventId));
        return expiresAt != null && expiresAt.isAfter(Instant.now());
    }

    @Override
    public void markProcessed(String consumer, String eventId) {
        Instant now = Instant.now();
        processed.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
        processed.put(key(consumer, eventId), now.plus(ttl));
    }

    private static String key(String consumer, String eventId) {
        return consumer + ":" + eventId;
    }
}
