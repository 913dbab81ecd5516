package com.tripdispatch.trip.service;

import com.tripdispatch.trip.entity.Trip;

import java.util.Optional;

/**
 * Outcome of a lifecycle operation. Rejections are values, not exceptions: callers such as
 * the matching loop branch on {@link #getOutcome()} and keep going.
 */
public final class TripOperationResult {

    public enum Outcome {
        APPLIED,
        /** The trip's current status does not allow the requested transition. */
        INVALID_TRANSITION,
        NOT_FOUND,
        /** Another writer changed the trip between validation and update. */
        CONFLICT,
        /** A business rule refused the operation (active trip, busy driver, rating rules). */
        RULE_VIOLATION
    }

    private final Outcome outcome;
    private final Trip trip;
    private final String reason;

    private TripOperationResult(Outcome outcome, Trip trip, String reason) {
        this.outcome = outcome;
        this.trip = trip;
        this.reason = reason;
    }

    public static TripOperationResult applied(Trip trip) {
        return new TripOperationResult(Outcome.APPLIED, trip, null);
    }

    public static TripOperationResult rejected(Outcome outcome, String reason) {
        if (outcome == Outcome.APPLIED) {
            throw new IllegalArgumentException("A rejection needs a non-APPLIED outcome");
        }
        return new TripOperationResult(outcome, null, reason);
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Optional<Trip> getTrip() {
        return Optional.ofNullable(trip);
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isApplied() ? "APPLIED(" + trip.getId() + ")" : outcome + "(" + reason + ")";
    }
}
