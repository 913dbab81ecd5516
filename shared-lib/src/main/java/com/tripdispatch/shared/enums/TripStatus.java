package com.tripdispatch.shared.enums;

import java.util.EnumSet;
import java.util.Set;

public enum TripStatus {
    PENDING,
    MATCHING,
    ACCEPTED,
    DRIVER_ARRIVED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    EXPIRED;

    /** Statuses that count as the rider's current trip. */
    public static final Set<TripStatus> ACTIVE =
            EnumSet.of(PENDING, MATCHING, ACCEPTED, DRIVER_ARRIVED, IN_PROGRESS);

    /** Statuses in which a driver is bound to the trip. */
    public static final Set<TripStatus> DRIVER_ENGAGED =
            EnumSet.of(ACCEPTED, DRIVER_ARRIVED, IN_PROGRESS);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == EXPIRED;
    }
}
