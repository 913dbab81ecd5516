package com.tripdispatch.trip.repository;

import com.tripdispatch.shared.enums.TripStatus;

import java.util.UUID;

public interface TripRepositoryCustom {

    /**
     * Atomically moves a trip from {@code expected} to {@code next}, writing {@code update}
     * in the same statement. Returns false when the trip is missing or no longer in
     * {@code expected}; concurrent callers racing on one trip see exactly one success.
     * Binding a driver who is engaged on another trip throws
     * {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    boolean conditionalUpdateStatus(UUID tripId, TripStatus expected, TripStatus next, TripUpdate update);

    /**
     * Writes {@code update} only while the trip is in {@code expected}, leaving the status unchanged.
     */
    boolean conditionalUpdate(UUID tripId, TripStatus expected, TripUpdate update);
}
