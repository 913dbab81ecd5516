package com.tripdispatch.trip.service;

import com.tripdispatch.shared.enums.TripStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed trip status transitions.
 *
 * <pre>
 * PENDING -> MATCHING -> ACCEPTED -> DRIVER_ARRIVED -> IN_PROGRESS -> COMPLETED
 *    |          |  \         |              |               |
 *    +----------+---+--------+--------------+---------------+--> CANCELLED
 *               +--> EXPIRED
 * </pre>
 *
 * Terminal states have no outgoing edges.
 */
public final class TripStateMachine {

    private static final Map<TripStatus, Set<TripStatus>> TRANSITIONS = new EnumMap<>(TripStatus.class);

    static {
        TRANSITIONS.put(TripStatus.PENDING, EnumSet.of(TripStatus.MATCHING, TripStatus.CANCELLED));
        TRANSITIONS.put(TripStatus.MATCHING, EnumSet.of(TripStatus.ACCEPTED, TripStatus.CANCELLED, TripStatus.EXPIRED));
        TRANSITIONS.put(TripStatus.ACCEPTED, EnumSet.of(TripStatus.DRIVER_ARRIVED, TripStatus.CANCELLED));
        TRANSITIONS.put(TripStatus.DRIVER_ARRIVED, EnumSet.of(TripStatus.IN_PROGRESS, TripStatus.CANCELLED));
        TRANSITIONS.put(TripStatus.IN_PROGRESS, EnumSet.of(TripStatus.COMPLETED, TripStatus.CANCELLED));
        TRANSITIONS.put(TripStatus.COMPLETED, EnumSet.noneOf(TripStatus.class));
        TRANSITIONS.put(TripStatus.CANCELLED, EnumSet.noneOf(TripStatus.class));
        TRANSITIONS.put(TripStatus.EXPIRED, EnumSet.noneOf(TripStatus.class));
    }

    private TripStateMachine() {}

    public static boolean canTransition(TripStatus from, TripStatus to) {
        return from != null && to != null && TRANSITIONS.get(from).contains(to);
    }

    public static Set<TripStatus> allowedTargets(TripStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }
}
