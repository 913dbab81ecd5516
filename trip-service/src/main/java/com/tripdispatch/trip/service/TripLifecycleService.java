package com.tripdispatch.trip.service;

import com.tripdispatch.shared.enums.TripActor;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.eventbus.EventBus;
import com.tripdispatch.shared.events.DomainEvent;
import com.tripdispatch.trip.entity.Trip;
import com.tripdispatch.trip.model.CreateTripRequest;
import com.tripdispatch.trip.repository.TripRepository;
import com.tripdispatch.trip.repository.TripUpdate;
import com.tripdispatch.trip.service.TripOperationResult.Outcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Owns every trip status change.
 *
 * Transition flow:
 *  1. Load the trip and validate the edge against {@link TripStateMachine}
 *  2. Apply it with one conditional update (WHERE status = current), so concurrent
 *     writers on the same trip see exactly one winner
 *  3. Evict the cached snapshot
 *  4. Publish the matching domain event, only once the row is committed
 *
 * Nothing here throws for business outcomes; callers inspect {@link TripOperationResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripLifecycleService {

    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final TripRepository tripRepository;
    private final EventBus eventBus;
    private final TripCache tripCache;

    public TripOperationResult create(CreateTripRequest req) {
        if (tripRepository.existsByRiderIdAndStatusIn(req.getRiderId(), TripStatus.ACTIVE)) {
            log.warn("Rider {} already has an active trip, rejecting new request", req.getRiderId());
            return TripOperationResult.rejected(Outcome.RULE_VIOLATION,
                    "Rider " + req.getRiderId() + " already has an active trip");
        }

        Trip trip = Trip.builder()
                .riderId(req.getRiderId())
                .status(TripStatus.PENDING)
                .pickupLat(req.getPickupLat())
                .pickupLng(req.getPickupLng())
                .pickupAddress(req.getPickupAddress())
                .dropoffLat(req.getDropoffLat())
                .dropoffLng(req.getDropoffLng())
                .dropoffAddress(req.getDropoffAddress())
                .fareEstimate(req.getFareEstimate())
                .surgeMultiplier(req.getSurgeMultiplier() != null ? req.getSurgeMultiplier() : 1.0)
                .currency(req.getCurrency() != null ? req.getCurrency() : "USD")
                .paymentMethod(req.getPaymentMethod())
                .riderComment(req.getComment())
                .build();

        try {
            trip = tripRepository.saveAndFlush(trip);
        } catch (DataIntegrityViolationException e) {
            log.warn("Rider {} got an active trip concurrently, rejecting new request", req.getRiderId());
            return TripOperationResult.rejected(Outcome.RULE_VIOLATION,
                    "Rider " + req.getRiderId() + " already has an active trip");
        }
        publish(TripEvents.created(trip));
        log.info("Trip {} created for rider {} at ({},{})", trip.getId(), trip.getRiderId(),
                trip.getPickupLat(), trip.getPickupLng());
        return TripOperationResult.applied(trip);
    }

    public TripOperationResult startMatching(UUID tripId) {
        return transition(tripId, TripStatus.MATCHING, TripUpdate.none(), TripEvents::matchingRequested);
    }

    /**
     * MATCHING -> ACCEPTED for {@code driverId}. Refused with RULE_VIOLATION while the
     * driver is bound to another trip.
     */
    public TripOperationResult accept(UUID tripId, String driverId) {
        if (tripRepository.existsByDriverIdAndStatusIn(driverId, TripStatus.DRIVER_ENGAGED)) {
            log.warn("Driver {} already has an active trip, cannot accept trip {}", driverId, tripId);
            return TripOperationResult.rejected(Outcome.RULE_VIOLATION,
                    "Driver " + driverId + " already has an active trip");
        }
        TripUpdate update = TripUpdate.builder()
                .driverId(driverId)
                .acceptedAt(Instant.now())
                .build();
        try {
            return transition(tripId, TripStatus.ACCEPTED, update, TripEvents::accepted);
        } catch (DataIntegrityViolationException e) {
            log.warn("Driver {} was bound to another trip concurrently, cannot accept trip {}", driverId, tripId);
            return TripOperationResult.rejected(Outcome.RULE_VIOLATION,
                    "Driver " + driverId + " already has an active trip");
        }
    }

    public TripOperationResult driverArrived(UUID tripId) {
        return transition(tripId, TripStatus.DRIVER_ARRIVED,
                TripUpdate.builder().arrivedAt(Instant.now()).build(), TripEvents::driverArrived);
    }

    public TripOperationResult startRide(UUID tripId) {
        return transition(tripId, TripStatus.IN_PROGRESS,
                TripUpdate.builder().startedAt(Instant.now()).build(), TripEvents::started);
    }

    /**
     * IN_PROGRESS -> COMPLETED. Without an explicit {@code finalFare} the estimate is charged.
     */
    public TripOperationResult complete(UUID tripId, BigDecimal finalFare) {
        Optional<Trip> current = tripRepository.findById(tripId);
        if (current.isEmpty()) {
            return notFound(tripId);
        }
        BigDecimal fare = finalFare != null ? finalFare : current.get().getFareEstimate();
        TripUpdate.Builder update = TripUpdate.builder().completedAt(Instant.now());
        if (fare != null) {
            update.finalFare(fare);
        }
        return apply(current.get(), TripStatus.COMPLETED, update.build(), TripEvents::completed);
    }

    /**
     * Any non-terminal status -> CANCELLED. A concurrent transition (say MATCHING -> ACCEPTED)
     * does not defeat the cancel: the status is re-read and the cancel retried.
     */
    public TripOperationResult cancel(UUID tripId, TripActor actor, String reason) {
        TripUpdate update = TripUpdate.builder()
                .cancelledAt(Instant.now())
                .cancelledBy(actor)
                .cancellationReason(reason)
                .build();

        TripOperationResult result = null;
        for (int attempt = 1; attempt <= MAX_CANCEL_ATTEMPTS; attempt++) {
            result = transition(tripId, TripStatus.CANCELLED, update, TripEvents::cancelled);
            if (result.getOutcome() != Outcome.CONFLICT) {
                return result;
            }
            log.info("Cancel of trip {} lost a race (attempt {}/{}), retrying", tripId, attempt, MAX_CANCEL_ATTEMPTS);
        }
        return result;
    }

    /**
     * MATCHING -> EXPIRED once matching has run out of candidates.
     */
    public TripOperationResult expire(UUID tripId) {
        return transition(tripId, TripStatus.EXPIRED,
                TripUpdate.builder().expiredAt(Instant.now()).build(), TripEvents::expired);
    }

    /**
     * Rating of a COMPLETED trip: the rider rates the driver, the driver rates the rider,
     * each at most once, on a 1-5 scale.
     */
    public TripOperationResult rate(UUID tripId, TripActor ratedBy, int rating) {
        if (rating < 1 || rating > 5) {
            return TripOperationResult.rejected(Outcome.RULE_VIOLATION, "Rating must be between 1 and 5");
        }
        if (ratedBy == TripActor.SYSTEM) {
            return TripOperationResult.rejected(Outcome.RULE_VIOLATION, "Only the rider or the driver can rate a trip");
        }
        Optional<Trip> current = tripRepository.findById(tripId);
        if (current.isEmpty()) {
            return notFound(tripId);
        }
        Trip trip = current.get();
        if (trip.getStatus() != TripStatus.COMPLETED) {
            return TripOperationResult.rejected(Outcome.INVALID_TRANSITION,
                    "Trip " + tripId + " is " + trip.getStatus() + ", only completed trips can be rated");
        }
        boolean riderRates = ratedBy == TripActor.RIDER;
        if ((riderRates ? trip.getDriverRating() : trip.getRiderRating()) != null) {
            return TripOperationResult.rejected(Outcome.RULE_VIOLATION,
                    "Trip " + tripId + " was already rated by the " + ratedBy.wireName());
        }

        TripUpdate update = riderRates
                ? TripUpdate.builder().driverRating(rating).build()
                : TripUpdate.builder().riderRating(rating).build();
        if (!tripRepository.conditionalUpdate(tripId, TripStatus.COMPLETED, update)) {
            return TripOperationResult.rejected(Outcome.CONFLICT, "Trip " + tripId + " changed while rating");
        }
        tripCache.evict(tripId);
        Trip rated = snapshot(trip, null, update);
        publish(TripEvents.rated(rated, ratedBy, rating));
        log.info("Trip {} rated {} by {}", tripId, rating, ratedBy.wireName());
        return TripOperationResult.applied(rated);
    }

    public Optional<Trip> getTrip(UUID tripId) {
        Optional<Trip> cached = tripCache.get(tripId);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<Trip> trip = tripRepository.findById(tripId);
        trip.ifPresent(tripCache::put);
        return trip;
    }

    /**
     * Current row from the database, bypassing the cache. Used where a stale status would
     * start work for a trip that already moved on.
     */
    public Optional<Trip> loadTrip(UUID tripId) {
        return tripRepository.findById(tripId);
    }

    public Optional<Trip> findActiveTripForRider(String riderId) {
        return tripRepository.findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(riderId, TripStatus.ACTIVE);
    }

    public Optional<Trip> findActiveTripForDriver(String driverId) {
        return tripRepository.findFirstByDriverIdAndStatusInOrderByCreatedAtDesc(driverId, TripStatus.DRIVER_ENGAGED);
    }

    public List<Trip> findTripsForRider(String riderId) {
        return tripRepository.findByRiderIdOrderByCreatedAtDesc(riderId);
    }

    // --- helpers ---

    private TripOperationResult transition(UUID tripId, TripStatus next, TripUpdate update,
                                           Function<Trip, DomainEvent> eventFactory) {
        Optional<Trip> current = tripRepository.findById(tripId);
        if (current.isEmpty()) {
            return notFound(tripId);
        }
        return apply(current.get(), next, update, eventFactory);
    }

    private TripOperationResult apply(Trip trip, TripStatus next, TripUpdate update,
                                      Function<Trip, DomainEvent> eventFactory) {
        UUID tripId = trip.getId();
        TripStatus from = trip.getStatus();
        if (!TripStateMachine.canTransition(from, next)) {
            log.warn("Rejected transition {} -> {} for trip {}", from, next, tripId);
            return TripOperationResult.rejected(Outcome.INVALID_TRANSITION,
                    "Cannot move trip " + tripId + " from " + from + " to " + next);
        }
        if (!tripRepository.conditionalUpdateStatus(tripId, from, next, update)) {
            log.warn("Trip {} changed concurrently, {} -> {} not applied", tripId, from, next);
            return TripOperationResult.rejected(Outcome.CONFLICT,
                    "Trip " + tripId + " is no longer " + from);
        }
        tripCache.evict(tripId);

        Trip updated = snapshot(trip, next, update);
        publish(eventFactory.apply(updated));
        log.info("Trip {} transitioned {} -> {}", tripId, from, next);
        return TripOperationResult.applied(updated);
    }

    private static Trip snapshot(Trip before, TripStatus next, TripUpdate update) {
        Trip after = before.toBuilder().build();
        if (next != null) {
            after.setStatus(next);
        }
        update.applyTo(after);
        after.setUpdatedAt(Instant.now());
        after.syncGuards();
        return after;
    }

    // The row is already committed; a lost event must not turn the change into a failure
    private void publish(DomainEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} for trip {}: {}", event.getEventType(),
                    event.getPayload().get(TripEvents.TRIP_ID), e.getMessage(), e);
        }
    }

    private TripOperationResult notFound(UUID tripId) {
        log.warn("Trip {} not found", tripId);
        return TripOperationResult.rejected(Outcome.NOT_FOUND, "Trip " + tripId + " not found");
    }
}
