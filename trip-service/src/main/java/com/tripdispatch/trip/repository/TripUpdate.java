package com.tripdispatch.trip.repository;

import com.tripdispatch.shared.enums.TripActor;
import com.tripdispatch.trip.entity.Trip;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Typed set of extra column values applied together with a conditional status change.
 * Built only through {@link Builder}, so every value is checked against its column type
 * at compile time.
 */
public final class TripUpdate {

    private static final TripUpdate NONE = new TripUpdate(new EnumMap<>(TripField.class));

    private final Map<TripField, Object> values;

    private TripUpdate(EnumMap<TripField, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TripUpdate none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<TripField, Object> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Mirrors the update on an in-memory copy, matching what the conditional UPDATE wrote.
     */
    public void applyTo(Trip trip) {
        values.forEach((field, value) -> {
            switch (field) {
                case DRIVER_ID:           trip.setDriverId((String) value); break;
                case ACCEPTED_AT:         trip.setAcceptedAt((Instant) value); break;
                case ARRIVED_AT:          trip.setArrivedAt((Instant) value); break;
                case STARTED_AT:          trip.setStartedAt((Instant) value); break;
                case COMPLETED_AT:        trip.setCompletedAt((Instant) value); break;
                case FINAL_FARE:          trip.setFinalFare((BigDecimal) value); break;
                case CANCELLED_AT:        trip.setCancelledAt((Instant) value); break;
                case CANCELLED_BY:        trip.setCancelledBy((TripActor) value); break;
                case CANCELLATION_REASON: trip.setCancellationReason((String) value); break;
                case EXPIRED_AT:          trip.setExpiredAt((Instant) value); break;
                case DRIVER_RATING:       trip.setDriverRating((Integer) value); break;
                case RIDER_RATING:        trip.setRiderRating((Integer) value); break;
                default:                  throw new IllegalStateException("Unmapped field " + field);
            }
        });
    }

    @Override
    public String toString() {
        return "TripUpdate" + values;
    }

    public static final class Builder {

        private final EnumMap<TripField, Object> values = new EnumMap<>(TripField.class);

        private Builder() {}

        public Builder driverId(String driverId)             { return put(TripField.DRIVER_ID, driverId); }
        public Builder acceptedAt(Instant at)                { return put(TripField.ACCEPTED_AT, at); }
        public Builder arrivedAt(Instant at)                 { return put(TripField.ARRIVED_AT, at); }
        public Builder startedAt(Instant at)                 { return put(TripField.STARTED_AT, at); }
        public Builder completedAt(Instant at)               { return put(TripField.COMPLETED_AT, at); }
        public Builder finalFare(BigDecimal fare)            { return put(TripField.FINAL_FARE, fare); }
        public Builder cancelledAt(Instant at)               { return put(TripField.CANCELLED_AT, at); }
        public Builder cancelledBy(TripActor actor)          { return put(TripField.CANCELLED_BY, actor); }
        public Builder cancellationReason(String reason)     { return put(TripField.CANCELLATION_REASON, reason); }
        public Builder expiredAt(Instant at)                 { return put(TripField.EXPIRED_AT, at); }
        public Builder driverRating(int rating)              { return put(TripField.DRIVER_RATING, rating); }
        public Builder riderRating(int rating)               { return put(TripField.RIDER_RATING, rating); }

        public TripUpdate build() {
            return new TripUpdate(new EnumMap<>(values));
        }

        private Builder put(TripField field, Object value) {
            values.put(field, value);
            return this;
        }
    }
}
