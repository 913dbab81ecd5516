package com.tripdispatch.shared.events;

import java.util.List;

/**
 * Central registry of all domain event types. The type doubles as the routing key
 * (Kafka topic name) on the bus.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String TRIP_CREATED            = "trip.created";
    public static final String TRIP_MATCHING_REQUESTED = "trip.matching_requested";
    public static final String TRIP_ACCEPTED           = "trip.accepted";
    public static final String TRIP_DRIVER_ARRIVED     = "trip.driver_arrived";
    public static final String TRIP_STARTED            = "trip.started";
    public static final String TRIP_COMPLETED          = "trip.completed";
    public static final String TRIP_CANCELLED          = "trip.cancelled";
    public static final String TRIP_EXPIRED            = "trip.expired";
    public static final String TRIP_RATED              = "trip.rated";
    public static final String OFFER_CREATED           = "offer.created";
    public static final String OFFER_ACCEPTED          = "offer.accepted";
    public static final String OFFER_REJECTED          = "offer.rejected";
    public static final String OFFER_EXPIRED           = "offer.expired";

    public static final List<String> ALL = List.of(
            TRIP_CREATED, TRIP_MATCHING_REQUESTED, TRIP_ACCEPTED, TRIP_DRIVER_ARRIVED,
            TRIP_STARTED, TRIP_COMPLETED, TRIP_CANCELLED, TRIP_EXPIRED, TRIP_RATED,
            OFFER_CREATED, OFFER_ACCEPTED, OFFER_REJECTED, OFFER_EXPIRED);

    /** Suffix of the dead-letter topic a failed record is parked on. */
    public static final String DEAD_LETTER_SUFFIX = ".DLT";
}
