package com.tripdispatch.dispatch.service;

import com.tripdispatch.dispatch.config.MatchingProperties;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.model.DriverCandidate;
import com.tripdispatch.dispatch.model.Offer;
import com.tripdispatch.shared.enums.OfferStatus;
import com.tripdispatch.shared.enums.TripActor;
import com.tripdispatch.shared.eventbus.EventBus;
import com.tripdispatch.shared.events.DomainEvent;
import com.tripdispatch.trip.service.TripLifecycleService;
import com.tripdispatch.trip.service.TripOperationResult;
import com.tripdispatch.trip.service.TripOperationResult.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Matching loop for one trip, run on its own thread by {@link MatchingEngine}.
 *
 * Loop:
 *  1. Query drivers within the current radius, drop those already notified or rejected
 *  2. Nobody left: widen the radius, count a retry, back off
 *  3. Otherwise offer the trip to the nearest free driver and wait for the answer
 *  4. Accepted: assign the driver through the lifecycle service and stop
 *  5. Rejected or timed out: exclude the driver and continue (retries are not reset)
 *  6. Radius or retries exhausted: expire the trip
 *
 * Offers are strictly sequential. {@link #cancel()} may come from any thread: it releases
 * the open offer's slots before returning and, once it has returned, the task starts no new
 * publish. An accepted offer holds its driver slot until the assignment has been written.
 */
@Slf4j
class MatchingTask implements Runnable {

    static final String MDC_TRIP_ID = "tripId";
    static final String SYSTEM_ERROR_REASON = "system_error";

    private final UUID tripId;
    private final double pickupLat;
    private final double pickupLng;
    private final MatchingProperties properties;
    private final GeoCandidateSource geoCandidateSource;
    private final OfferRegistry offerRegistry;
    private final TripLifecycleService lifecycle;
    private final EventBus eventBus;
    private final DispatchMetrics metrics;

    private final ExclusionSet exclusions = new ExclusionSet();
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final Object lock = new Object();

    // Written under lock, read without it
    private volatile boolean cancelled;
    private Offer currentOffer;

    // Set once the task is ending the trip itself; a cancel after that is not a rider or system stop
    private volatile boolean concluding;

    MatchingTask(UUID tripId, double pickupLat, double pickupLng,
                 MatchingProperties properties,
                 GeoCandidateSource geoCandidateSource,
                 OfferRegistry offerRegistry,
                 TripLifecycleService lifecycle,
                 EventBus eventBus,
                 DispatchMetrics metrics) {
        this.tripId = tripId;
        this.pickupLat = pickupLat;
        this.pickupLng = pickupLng;
        this.properties = properties;
        this.geoCandidateSource = geoCandidateSource;
        this.offerRegistry = offerRegistry;
        this.lifecycle = lifecycle;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    UUID getTripId() {
        return tripId;
    }

    boolean isConcluding() {
        return concluding;
    }

    @Override
    public void run() {
        MDC.put(MDC_TRIP_ID, tripId.toString());
        try {
            log.info("Matching started for trip {} at ({},{})", tripId, pickupLat, pickupLng);
            match(Instant.now());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Matching for trip {} interrupted", tripId);
        } catch (RuntimeException e) {
            abort(e);
        } finally {
            MDC.remove(MDC_TRIP_ID);
        }
    }

    /**
     * Stops the task. Idempotent; returns false if it was already cancelled.
     */
    boolean cancel() {
        Offer pending;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            pending = currentOffer;
            currentOffer = null;
        }
        cancelSignal.countDown();
        if (pending != null) {
            offerRegistry.release(pending);
            pending.resolve(OfferStatus.CANCELLED);
            log.info("Withdrew offer {} to driver {} for cancelled trip {}", pending.getOfferId(), pending.getDriverId(), tripId);
        }
        return true;
    }

    private void match(Instant startedAt) throws InterruptedException {
        double radius = properties.getMinRadiusKm();
        int retries = 0;

        while (!cancelled && radius <= properties.getMaxRadiusKm() && retries < properties.getMaxRetries()) {
            List<DriverCandidate> eligible = eligibleCandidates(radius);
            Offer offer = eligible.isEmpty() ? null : offerToNearest(eligible);
            if (offer != null && offer.getStatus() == OfferStatus.ACCEPTED) {
                try {
                    if (!cancelled && assignDriver(offer, startedAt)) {
                        return;
                    }
                } finally {
                    offerRegistry.releaseDriverSlot(offer);
                }
            }
            if (cancelled) {
                return;
            }
            if (offer != null) {
                continue;
            }

            radius += properties.getRadiusStepKm();
            retries++;
            log.debug("No eligible driver for trip {}, widening search to {} km (retry {}/{})",
                    tripId, radius, retries, properties.getMaxRetries());
            boolean another = radius <= properties.getMaxRadiusKm() && retries < properties.getMaxRetries();
            if (another && awaitCancel(properties.getRetryBackoff())) {
                return;
            }
        }

        if (!cancelled) {
            expireTrip();
        }
    }

    private List<DriverCandidate> eligibleCandidates(double radiusKm) {
        List<DriverCandidate> found;
        try {
            found = geoCandidateSource.nearby(pickupLat, pickupLng, radiusKm, properties.getMaxCandidates());
        } catch (RuntimeException e) {
            log.warn("Candidate search failed for trip {} at {} km, treating as empty: {}", tripId, radiusKm, e.getMessage());
            return List.of();
        }
        if (found == null || found.isEmpty()) {
            return List.of();
        }
        return exclusions.filter(found).stream()
                .sorted(Comparator.comparingDouble(DriverCandidate::getDistanceKm))
                .toList();
    }

    /**
     * Offers the trip to the first candidate whose driver slot is free. Returns the resolved
     * offer, or null when every candidate was busy elsewhere.
     */
    private Offer offerToNearest(List<DriverCandidate> eligible) throws InterruptedException {
        for (DriverCandidate candidate : eligible) {
            Offer offer = Offer.create(tripId, candidate, properties.getOfferTimeout());
            if (claim(offer)) {
                awaitResponse(offer);
                return offer;
            }
            if (cancelled) {
                return null;
            }
        }
        return null;
    }

    private boolean claim(Offer offer) {
        synchronized (lock) {
            if (cancelled || !offerRegistry.claim(offer)) {
                return false;
            }
            currentOffer = offer;
            return true;
        }
    }

    private void awaitResponse(Offer offer) throws InterruptedException {
        String driverId = offer.getDriverId();
        OfferStatus status = null;
        try {
            publishUnlessCancelled(OfferEvents.created(offer));
            exclusions.markNotified(driverId);
            metrics.recordOfferCreated();
            log.info("Offered trip {} to driver {} at {} km (expires {})",
                    tripId, driverId, offer.getDistanceKm(), offer.getExpiresAt());

            status = offer.awaitOutcome(properties.getOfferTimeout());
        } finally {
            synchronized (lock) {
                if (currentOffer == offer) {
                    currentOffer = null;
                }
            }
            if (status == OfferStatus.ACCEPTED) {
                offerRegistry.releaseTripSlot(offer);
            } else {
                offerRegistry.release(offer);
            }
        }

        if (status == OfferStatus.REJECTED) {
            exclusions.markRejected(driverId);
            metrics.recordOfferRejected();
            log.info("Driver {} rejected trip {}", driverId, tripId);
            publishUnlessCancelled(OfferEvents.rejected(offer));
        } else if (status == OfferStatus.EXPIRED) {
            exclusions.markRejected(driverId);
            metrics.recordOfferExpired();
            log.info("Offer to driver {} for trip {} timed out after {}s", driverId, tripId,
                    properties.getOfferTimeout().toSeconds());
            publishUnlessCancelled(OfferEvents.expired(offer));
        }
    }

    /**
     * Returns true when the task is done: the driver is assigned, or the trip left MATCHING.
     * Returns false when the driver turned out to be busy and matching should continue.
     */
    private boolean assignDriver(Offer offer, Instant startedAt) throws InterruptedException {
        String driverId = offer.getDriverId();
        TripOperationResult result = withRepositoryRetry("accept", () -> lifecycle.accept(tripId, driverId));
        if (result == null) {
            return true;
        }
        if (result.isApplied()) {
            metrics.recordOfferAccepted();
            metrics.recordMatched(Duration.between(startedAt, Instant.now()));
            publishUnlessCancelled(OfferEvents.accepted(offer));
            log.info("Trip {} matched with driver {}", tripId, driverId);
            return true;
        }
        if (result.getOutcome() == Outcome.RULE_VIOLATION) {
            exclusions.markRejected(driverId);
            log.warn("Driver {} accepted trip {} but cannot take it: {}", driverId, tripId, result.getReason());
            return false;
        }
        log.info("Trip {} left MATCHING before driver {} was assigned: {}", tripId, driverId, result);
        return true;
    }

    private void expireTrip() throws InterruptedException {
        log.info("No driver found for trip {} ({} driver(s) declined or timed out)", tripId, exclusions.rejected().size());
        concluding = true;
        TripOperationResult result = withRepositoryRetry("expire", () -> lifecycle.expire(tripId));
        if (result == null) {
            return;
        }
        if (result.isApplied()) {
            metrics.recordMatchingExpired();
        } else {
            log.info("Trip {} was not expired: {}", tripId, result);
        }
    }

    private TripOperationResult withRepositoryRetry(String operation, Supplier<TripOperationResult> call)
            throws InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (DataAccessException | TransactionException e) {
                if (attempt >= properties.getRepositoryRetries()) {
                    throw new MatchingAbortedException(
                            "Trip repository unavailable during " + operation + " of trip " + tripId, e);
                }
                log.warn("Trip repository failed during {} of trip {} (attempt {}/{}): {}",
                        operation, tripId, attempt, properties.getRepositoryRetries(), e.getMessage());
                if (awaitCancel(properties.getRepositoryRetryBackoff())) {
                    return null;
                }
            }
        }
    }

    private void abort(RuntimeException cause) {
        metrics.recordMatchingFailed();
        if (cancelled) {
            log.warn("Matching for trip {} failed after cancellation: {}", tripId, cause.getMessage());
            return;
        }
        log.error("Matching for trip {} aborted, cancelling trip as system error", tripId, cause);
        try {
            TripOperationResult result = lifecycle.cancel(tripId, TripActor.SYSTEM, SYSTEM_ERROR_REASON);
            log.info("System cancellation of trip {}: {}", tripId, result);
        } catch (RuntimeException e) {
            log.error("Could not cancel trip {} after matching failure: {}", tripId, e.getMessage());
        }
    }

    // Runs outside the lock: a slow broker must not hold up cancel()
    private void publishUnlessCancelled(DomainEvent event) {
        if (cancelled) {
            log.debug("Trip {} cancelled, dropping {}", tripId, event.getEventType());
            return;
        }
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} for trip {}: {}", event.getEventType(), tripId, e.getMessage(), e);
        }
    }

    /**
     * Sleeps for {@code duration} unless cancelled first. Returns true if cancelled.
     */
    private boolean awaitCancel(Duration duration) throws InterruptedException {
        return cancelSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    static class MatchingAbortedException extends RuntimeException {
        MatchingAbortedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
