package com.tripdispatch.dispatch.service;

import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.eventbus.DomainEventHandler;
import com.tripdispatch.shared.eventbus.EventBus;
import com.tripdispatch.shared.eventbus.IdempotentEventHandler;
import com.tripdispatch.shared.eventbus.ProcessedEventStore;
import com.tripdispatch.shared.events.DomainEvent;
import com.tripdispatch.shared.events.EventTypes;
import com.tripdispatch.trip.entity.Trip;
import com.tripdispatch.trip.service.TripEvents;
import com.tripdispatch.trip.service.TripLifecycleService;
import com.tripdispatch.trip.service.TripOperationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Glue between trip lifecycle events and the matching engine.
 *
 *   trip.created            -> PENDING to MATCHING
 *   trip.matching_requested -> spawn a matching task (only while the trip is MATCHING)
 *   trip.cancelled / trip.completed / trip.expired -> stop any task for the trip
 *
 * Every handler is wrapped in {@link IdempotentEventHandler}, so redelivered events are no-ops.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchCoordinator {

    public static final String CONSUMER_NAME = "dispatch-coordinator";

    private final EventBus eventBus;
    private final ProcessedEventStore processedEventStore;
    private final TripLifecycleService lifecycle;
    private final MatchingEngine matchingEngine;

    private final AtomicBoolean registered = new AtomicBoolean();

    /**
     * Subscribes the coordinator's handlers. Safe to call more than once.
     */
    public void register() {
        if (!registered.compareAndSet(false, true)) {
            return;
        }
        subscribe(EventTypes.TRIP_CREATED, this::onTripCreated);
        subscribe(EventTypes.TRIP_MATCHING_REQUESTED, this::onMatchingRequested);
        subscribe(EventTypes.TRIP_CANCELLED, this::onTripEnded);
        subscribe(EventTypes.TRIP_COMPLETED, this::onTripEnded);
        subscribe(EventTypes.TRIP_EXPIRED, this::onTripEnded);
        log.info("Dispatch coordinator subscribed as {}", CONSUMER_NAME);
    }

    void onTripCreated(DomainEvent event) {
        UUID tripId = event.requireUuid(TripEvents.TRIP_ID);
        withTripContext(tripId, () -> {
            TripOperationResult result = lifecycle.startMatching(tripId);
            if (!result.isApplied()) {
                log.info("Trip {} not moved to MATCHING: {}", tripId, result);
            }
        });
    }

    void onMatchingRequested(DomainEvent event) {
        UUID tripId = event.requireUuid(TripEvents.TRIP_ID);
        withTripContext(tripId, () -> {
            Optional<Trip> trip = lifecycle.loadTrip(tripId);
            if (trip.isEmpty()) {
                log.warn("Matching requested for unknown trip {}", tripId);
                return;
            }
            if (trip.get().getStatus() != TripStatus.MATCHING) {
                log.info("Trip {} is {}, not spawning a matching task", tripId, trip.get().getStatus());
                return;
            }
            matchingEngine.spawn(tripId, trip.get().getPickupLat(), trip.get().getPickupLng());
        });
    }

    void onTripEnded(DomainEvent event) {
        UUID tripId = event.requireUuid(TripEvents.TRIP_ID);
        withTripContext(tripId, () -> {
            log.debug("{} for trip {}, stopping matching", event.getEventType(), tripId);
            matchingEngine.cancel(tripId);
        });
    }

    private void subscribe(String eventType, DomainEventHandler handler) {
        eventBus.subscribe(eventType, new IdempotentEventHandler(CONSUMER_NAME, processedEventStore, handler));
    }

    private static void withTripContext(UUID tripId, Runnable action) {
        String previous = MDC.get(MatchingTask.MDC_TRIP_ID);
        MDC.put(MatchingTask.MDC_TRIP_ID, tripId.toString());
        try {
            action.run();
        } finally {
            if (previous != null) {
                MDC.put(MatchingTask.MDC_TRIP_ID, previous);
            } else {
                MDC.remove(MatchingTask.MDC_TRIP_ID);
            }
        }
    }
}
