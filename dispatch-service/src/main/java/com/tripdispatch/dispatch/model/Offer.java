package com.tripdispatch.dispatch.model;

import com.tripdispatch.shared.enums.OfferStatus;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A proposal of one trip to one driver, open until the driver responds, the timeout passes
 * or matching is cancelled. The first of those to call {@link #resolve} decides the outcome.
 */
@Getter
public class Offer {

    private final String offerId;
    private final UUID tripId;
    private final String driverId;
    private final double distanceKm;
    private final Instant createdAt;
    private final Instant expiresAt;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<OfferStatus> status = new AtomicReference<>(OfferStatus.PENDING);

    @Getter(lombok.AccessLevel.NONE)
    private final CompletableFuture<OfferStatus> outcome = new CompletableFuture<>();

    private Offer(UUID tripId, DriverCandidate candidate, Instant createdAt, Duration timeout) {
        this.offerId = UUID.randomUUID().toString();
        this.tripId = tripId;
        this.driverId = candidate.getDriverId();
        this.distanceKm = candidate.getDistanceKm();
        this.createdAt = createdAt;
        this.expiresAt = createdAt.plus(timeout);
    }

    public static Offer create(UUID tripId, DriverCandidate candidate, Duration timeout) {
        return new Offer(tripId, candidate, Instant.now(), timeout);
    }

    public OfferStatus getStatus() {
        return status.get();
    }

    public boolean isPending() {
        return status.get() == OfferStatus.PENDING;
    }

    /**
     * Moves a PENDING offer to {@code terminal}. Returns false if the offer was already resolved.
     */
    public boolean resolve(OfferStatus terminal) {
        if (terminal == OfferStatus.PENDING) {
            throw new IllegalArgumentException("PENDING is not a terminal offer status");
        }
        if (status.compareAndSet(OfferStatus.PENDING, terminal)) {
            outcome.complete(terminal);
            return true;
        }
        return false;
    }

    /**
     * Blocks until the offer is resolved or {@code timeout} passes; on timeout the offer
     * expires unless a response won the race at the last moment.
     */
    public OfferStatus awaitOutcome(Duration timeout) throws InterruptedException {
        try {
            return outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            resolve(OfferStatus.EXPIRED);
            return status.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Offer outcome completed exceptionally", e.getCause());
        }
    }
}
