package com.tripdispatch.trip.service;

import com.tripdispatch.shared.enums.TripActor;
import com.tripdispatch.shared.events.DomainEvent;
import com.tripdispatch.shared.events.EventTypes;
import com.tripdispatch.trip.entity.Trip;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the domain events emitted by trip transitions. Every payload carries
 * {@code trip_id}, {@code rider_id} and {@code status}; the rest depends on the transition.
 */
public final class TripEvents {

    public static final String TRIP_ID       = "trip_id";
    public static final String RIDER_ID      = "rider_id";
    public static final String DRIVER_ID     = "driver_id";
    public static final String STATUS        = "status";
    public static final String PICKUP_LAT    = "pickup_lat";
    public static final String PICKUP_LNG    = "pickup_lng";
    public static final String DROPOFF_LAT   = "dropoff_lat";
    public static final String DROPOFF_LNG   = "dropoff_lng";
    public static final String FARE_ESTIMATE = "fare_estimate";
    public static final String FINAL_FARE    = "final_fare";
    public static final String CANCELLED_BY  = "cancelled_by";
    public static final String REASON        = "reason";
    public static final String RATED_BY      = "rated_by";
    public static final String RATING        = "rating";

    private TripEvents() {}

    public static DomainEvent created(Trip trip) {
        Map<String, Object> payload = base(trip);
        putPickup(payload, trip);
        payload.put(DROPOFF_LAT, trip.getDropoffLat());
        payload.put(DROPOFF_LNG, trip.getDropoffLng());
        payload.put(FARE_ESTIMATE, trip.getFareEstimate());
        return DomainEvent.of(EventTypes.TRIP_CREATED, payload);
    }

    public static DomainEvent matchingRequested(Trip trip) {
        Map<String, Object> payload = base(trip);
        putPickup(payload, trip);
        return DomainEvent.of(EventTypes.TRIP_MATCHING_REQUESTED, payload);
    }

    public static DomainEvent accepted(Trip trip) {
        return withDriver(EventTypes.TRIP_ACCEPTED, trip);
    }

    public static DomainEvent driverArrived(Trip trip) {
        return withDriver(EventTypes.TRIP_DRIVER_ARRIVED, trip);
    }

    public static DomainEvent started(Trip trip) {
        return withDriver(EventTypes.TRIP_STARTED, trip);
    }

    public static DomainEvent completed(Trip trip) {
        Map<String, Object> payload = base(trip);
        payload.put(DRIVER_ID, trip.getDriverId());
        payload.put(FINAL_FARE, trip.getFinalFare());
        return DomainEvent.of(EventTypes.TRIP_COMPLETED, payload);
    }

    public static DomainEvent cancelled(Trip trip) {
        Map<String, Object> payload = base(trip);
        payload.put(DRIVER_ID, trip.getDriverId());
        payload.put(CANCELLED_BY, trip.getCancelledBy() != null ? trip.getCancelledBy().wireName() : null);
        payload.put(REASON, trip.getCancellationReason());
        return DomainEvent.of(EventTypes.TRIP_CANCELLED, payload);
    }

    public static DomainEvent expired(Trip trip) {
        return DomainEvent.of(EventTypes.TRIP_EXPIRED, base(trip));
    }

    public static DomainEvent rated(Trip trip, TripActor ratedBy, int rating) {
        Map<String, Object> payload = base(trip);
        payload.put(DRIVER_ID, trip.getDriverId());
        payload.put(RATED_BY, ratedBy.wireName());
        payload.put(RATING, rating);
        return DomainEvent.of(EventTypes.TRIP_RATED, payload);
    }

    private static DomainEvent withDriver(String type, Trip trip) {
        Map<String, Object> payload = base(trip);
        payload.put(DRIVER_ID, trip.getDriverId());
        return DomainEvent.of(type, payload);
    }

    private static Map<String, Object> base(Trip trip) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TRIP_ID, trip.getId().toString());
        payload.put(RIDER_ID, trip.getRiderId());
        payload.put(STATUS, trip.getStatus().name());
        return payload;
    }

    private static void putPickup(Map<String, Object> payload, Trip trip) {
        payload.put(PICKUP_LAT, trip.getPickupLat());
        payload.put(PICKUP_LNG, trip.getPickupLng());
    }
}
