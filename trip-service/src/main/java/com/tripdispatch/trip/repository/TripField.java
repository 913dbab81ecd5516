package com.tripdispatch.trip.repository;

/**
 * Columns a status transition may write besides {@code status}. Anything outside this
 * list cannot be touched through {@link TripUpdate}.
 */
public enum TripField {
    DRIVER_ID("driverId"),
    ACCEPTED_AT("acceptedAt"),
    ARRIVED_AT("arrivedAt"),
    STARTED_AT("startedAt"),
    COMPLETED_AT("completedAt"),
    FINAL_FARE("finalFare"),
    CANCELLED_AT("cancelledAt"),
    CANCELLED_BY("cancelledBy"),
    CANCELLATION_REASON("cancellationReason"),
    EXPIRED_AT("expiredAt"),
    DRIVER_RATING("driverRating"),
    RIDER_RATING("riderRating");

    private final String attribute;

    TripField(String attribute) {
        this.attribute = attribute;
    }

    /** JPA attribute name on {@link com.tripdispatch.trip.entity.Trip}. */
    public String attribute() {
        return attribute;
    }
}
