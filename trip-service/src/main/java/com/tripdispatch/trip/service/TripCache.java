package com.tripdispatch.trip.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripdispatch.trip.entity.Trip;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-through cache of trip snapshots in Redis.
 *
 * Key pattern:  trip:{tripId}
 * Value:        Trip as JSON, expiring after dispatch.trips.cache.ttl
 *
 * Best effort: a Redis failure degrades to a database read and is only logged.
 * Every status transition evicts the key so readers never see a status older than the row.
 */
@Slf4j
@Component
public class TripCache {

    private static final String KEY_PREFIX = "trip:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final Duration ttl;

    public TripCache(RedisTemplate<String, String> redisTemplate,
                     ObjectMapper objectMapper,
                     @Value("${dispatch.trips.cache.enabled:true}") boolean enabled,
                     @Value("${dispatch.trips.cache.ttl:PT5M}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.ttl = ttl;
    }

    public Optional<Trip> get(UUID tripId) {
        if (!enabled) return Optional.empty();
        try {
            String json = redisTemplate.opsForValue().get(KEY_PREFIX + tripId);
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, Trip.class));
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Trip cache read failed for {}: {}", tripId, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(Trip trip) {
        if (!enabled) return;
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + trip.getId(), objectMapper.writeValueAsString(trip), ttl);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Trip cache write failed for {}: {}", trip.getId(), e.getMessage());
        }
    }

    public void evict(UUID tripId) {
        if (!enabled) return;
        try {
            redisTemplate.delete(KEY_PREFIX + tripId);
        } catch (DataAccessException e) {
            log.warn("Trip cache eviction failed for {}: {}", tripId, e.getMessage());
        }
    }
}
