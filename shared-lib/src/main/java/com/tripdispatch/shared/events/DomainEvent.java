package com.tripdispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tripdispatch.shared.eventbus.MalformedEventException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable envelope for every domain fact published on the event bus.
 *
 * Wire shape (JSON):
 *   { "event_id": uuid, "event_type": "trip.created", "timestamp": ISO-8601, "payload": {...} }
 *
 * The payload is copied on construction and exposed read-only, so later changes to the
 * caller's map never leak into a published event. Routing uses {@link #getEventType()}.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "eventId")
public final class DomainEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("event_id")
    private final String eventId;

    @JsonProperty("event_type")
    private final String eventType;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant timestamp;

    private final Map<String, Object> payload;

    @JsonCreator
    public DomainEvent(@JsonProperty("event_id") String eventId,
                       @JsonProperty("event_type") String eventType,
                       @JsonProperty("timestamp") Instant timestamp,
                       @JsonProperty("payload") Map<String, Object> payload) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * New event with a fresh id and the current time.
     */
    public static DomainEvent of(String eventType, Map<String, Object> payload) {
        return new DomainEvent(UUID.randomUUID().toString(), eventType, Instant.now(), payload);
    }

    /**
     * Payload value as a string, failing with {@link MalformedEventException} when absent.
     */
    public String requireString(String key) {
        Object value = payload.get(key);
        if (value == null) {
            throw new MalformedEventException(
                    "Event " + eventId + " (" + eventType + ") has no '" + key + "' in payload");
        }
        return value.toString();
    }

    public UUID requireUuid(String key) {
        String raw = requireString(key);
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException(
                    "Event " + eventId + " has invalid UUID '" + raw + "' for '" + key + "'", e);
        }
    }

    /**
     * Numeric payload value; JSON transports deliver numbers as Integer/Double, some producers as text.
     */
    public Double doubleValue(String key) {
        Object value = payload.get(key);
        if (value == null) return null;
        if (value instanceof Number number) return number.doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new MalformedEventException(
                    "Event " + eventId + " has non-numeric '" + key + "': " + value, e);
        }
    }
}
