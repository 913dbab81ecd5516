package com.tripdispatch.dispatch.service;

import com.tripdispatch.dispatch.config.MatchingProperties;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.model.Offer;
import com.tripdispatch.dispatch.model.OfferResponseOutcome;
import com.tripdispatch.shared.eventbus.EventBus;
import com.tripdispatch.trip.service.TripLifecycleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Owns the matching tasks of this process: at most one per trip.
 *
 * A task is registered before it is submitted and unregisters itself when it ends, whatever
 * the reason, so {@link #spawn} and {@link #cancel} only ever race on the map entry.
 */
@Slf4j
@Service
public class MatchingEngine implements DisposableBean {

    private final ConcurrentMap<UUID, MatchingTask> tasks = new ConcurrentHashMap<>();

    private final MatchingProperties properties;
    private final GeoCandidateSource geoCandidateSource;
    private final OfferRegistry offerRegistry;
    private final TripLifecycleService lifecycle;
    private final EventBus eventBus;
    private final DispatchMetrics metrics;
    private final ExecutorService executor;

    public MatchingEngine(MatchingProperties properties,
                          GeoCandidateSource geoCandidateSource,
                          OfferRegistry offerRegistry,
                          TripLifecycleService lifecycle,
                          EventBus eventBus,
                          DispatchMetrics metrics,
                          @Qualifier("matchingExecutor") ExecutorService executor) {
        this.properties = properties;
        this.geoCandidateSource = geoCandidateSource;
        this.offerRegistry = offerRegistry;
        this.lifecycle = lifecycle;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Starts matching for a trip. Returns false if a task for the trip is already running
     * or the executor refused the task.
     */
    public boolean spawn(UUID tripId, double pickupLat, double pickupLng) {
        MatchingTask task = new MatchingTask(tripId, pickupLat, pickupLng, properties,
                geoCandidateSource, offerRegistry, lifecycle, eventBus, metrics);
        if (tasks.putIfAbsent(tripId, task) != null) {
            log.debug("Matching already running for trip {}", tripId);
            return false;
        }

        metrics.recordMatchingStarted();
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } finally {
                    finished(task);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Matching executor rejected trip {}: {}", tripId, e.getMessage());
            finished(task);
            return false;
        }
        return true;
    }

    /**
     * Stops matching for a trip and frees its offer slots before returning. Idempotent; a trip
     * without a task is a no-op.
     */
    public void cancel(UUID tripId) {
        MatchingTask task = tasks.get(tripId);
        if (task != null && task.cancel() && !task.isConcluding()) {
            metrics.recordMatchingCancelled();
            log.info("Matching cancelled for trip {}", tripId);
        }
        offerRegistry.releaseTrip(tripId);
    }

    /**
     * Routes a driver's answer to the trip's pending offer.
     */
    public OfferResponseOutcome respond(UUID tripId, String driverId, boolean accepted, String offerId) {
        OfferResponseOutcome outcome = offerRegistry.respond(tripId, driverId, accepted, offerId);
        log.info("Driver {} {} trip {}: {}", driverId, accepted ? "accepted" : "rejected", tripId, outcome);
        return outcome;
    }

    public Optional<Offer> currentOfferForDriver(String driverId) {
        return offerRegistry.forDriver(driverId).filter(Offer::isPending);
    }

    public Optional<Offer> currentOfferForTrip(UUID tripId) {
        return offerRegistry.forTrip(tripId).filter(Offer::isPending);
    }

    public boolean isMatching(UUID tripId) {
        return tasks.containsKey(tripId);
    }

    public int activeTasks() {
        return tasks.size();
    }

    private void finished(MatchingTask task) {
        tasks.remove(task.getTripId(), task);
        metrics.recordMatchingFinished();
    }

    @Override
    public void destroy() throws InterruptedException {
        log.info("Stopping {} matching task(s)", tasks.size());
        tasks.values().forEach(MatchingTask::cancel);
        executor.shutdown();
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Matching tasks still running after shutdown grace period");
            executor.shutdownNow();
        }
    }
}
