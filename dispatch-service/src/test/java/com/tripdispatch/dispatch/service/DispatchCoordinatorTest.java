package com.tripdispatch.dispatch.service;

import com.tripdispatch.shared.enums.TripActor;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.eventbus.InMemoryEventBus;
import com.tripdispatch.shared.eventbus.InMemoryProcessedEventStore;
import com.tripdispatch.shared.events.DomainEvent;
import com.tripdispatch.shared.events.EventTypes;
import com.tripdispatch.trip.entity.Trip;
import com.tripdispatch.trip.service.TripEvents;
import com.tripdispatch.trip.service.TripLifecycleService;
import com.tripdispatch.trip.service.TripOperationResult;
import com.tripdispatch.trip.service.TripOperationResult.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispatchCoordinatorTest {

    @Mock private TripLifecycleService lifecycle;
    @Mock private MatchingEngine matchingEngine;

    private InMemoryEventBus eventBus;
    private UUID tripId;
    private Trip trip;

    @BeforeEach
    void setUp() {
        eventBus = new InMemoryEventBus(3);
        DispatchCoordinator coordinator = new DispatchCoordinator(eventBus,
                new InMemoryProcessedEventStore(Duration.ofHours(1)), lifecycle, matchingEngine);
        coordinator.register();
        coordinator.register();

        tripId = UUID.randomUUID();
        trip = Trip.builder()
                .id(tripId)
                .riderId("rider-1")
                .status(TripStatus.PENDING)
                .pickupLat(48.85)
                .pickupLng(2.35)
                .createdAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("trip.created moves the trip to MATCHING, once per event even if redelivered")
    void tripCreated_startsMatchingOnce() {
        when(lifecycle.startMatching(tripId)).thenReturn(TripOperationResult.applied(trip));
        DomainEvent created = TripEvents.created(trip);

        eventBus.publish(created);
        eventBus.publish(created);

        verify(lifecycle, times(1)).startMatching(tripId);
    }

    @Test
    @DisplayName("A trip that already left PENDING is left alone on trip.created")
    void tripCreated_rejectedTransitionIsNoop() {
        when(lifecycle.startMatching(tripId))
                .thenReturn(TripOperationResult.rejected(Outcome.INVALID_TRANSITION, "CANCELLED -> MATCHING"));

        eventBus.publish(TripEvents.created(trip));

        assertThat(eventBus.getDeadLetters()).isEmpty();
        verifyNoInteractions(matchingEngine);
    }

    @Test
    @DisplayName("trip.matching_requested spawns a task at the stored pickup location")
    void matchingRequested_spawnsTask() {
        trip.setStatus(TripStatus.MATCHING);
        when(lifecycle.loadTrip(tripId)).thenReturn(Optional.of(trip));

        eventBus.publish(TripEvents.matchingRequested(trip));

        verify(matchingEngine).spawn(tripId, 48.85, 2.35);
    }

    @Test
    @DisplayName("trip.matching_requested for a trip no longer MATCHING spawns nothing")
    void matchingRequested_staleEventIgnored() {
        trip.setStatus(TripStatus.MATCHING);
        DomainEvent requested = TripEvents.matchingRequested(trip);
        trip.setStatus(TripStatus.CANCELLED);
        when(lifecycle.loadTrip(tripId)).thenReturn(Optional.of(trip));

        eventBus.publish(requested);

        verify(matchingEngine, never()).spawn(any(), anyDouble(), anyDouble());
    }

    @Test
    @DisplayName("trip.cancelled, trip.completed and trip.expired all stop matching")
    void terminalEvents_cancelMatching() {
        trip.setStatus(TripStatus.CANCELLED);
        trip.setCancelledBy(TripActor.RIDER);
        eventBus.publish(TripEvents.cancelled(trip));
        trip.setStatus(TripStatus.EXPIRED);
        eventBus.publish(TripEvents.expired(trip));
        trip.setStatus(TripStatus.COMPLETED);
        eventBus.publish(TripEvents.completed(trip));

        verify(matchingEngine, times(3)).cancel(tripId);
    }

    @Test
    @DisplayName("An event without trip_id is dead-lettered without retries or side effects")
    void malformedEvent_deadLettered() {
        eventBus.publish(DomainEvent.of(EventTypes.TRIP_CANCELLED, Map.of("reason", "no id")));

        assertThat(eventBus.getDeadLetters()).hasSize(1);
        verifyNoInteractions(matchingEngine, lifecycle);
    }

    @Test
    @DisplayName("A handler failure is redelivered and the event is only marked processed after success")
    void handlerFailure_isRedelivered() {
        when(lifecycle.startMatching(tripId))
                .thenThrow(new IllegalStateException("db hiccup"))
                .thenReturn(TripOperationResult.applied(trip));
        DomainEvent created = TripEvents.created(trip);

        eventBus.publish(created);
        eventBus.publish(created);

        verify(lifecycle, times(2)).startMatching(tripId);
        assertThat(eventBus.getDeadLetters()).isEmpty();
    }
}
