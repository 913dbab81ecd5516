package com.tripdispatch.dispatch.service;

import com.tripdispatch.dispatch.model.Offer;
import com.tripdispatch.dispatch.model.OfferResponseOutcome;
import com.tripdispatch.shared.enums.OfferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Active-offer slots: at most one pending offer per trip and per driver.
 *
 * Slots are claimed with putIfAbsent and released with a value-conditional remove, so a
 * caller can only ever free the offer it holds; an occupied slot is never overwritten.
 */
@Slf4j
@Component
public class OfferRegistry {

    private final ConcurrentMap<UUID, Offer> byTrip = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Offer> byDriver = new ConcurrentHashMap<>();

    /**
     * Claims the driver slot, then the trip slot. Returns false, leaving both slots as they
     * were, if either is taken.
     */
    public boolean claim(Offer offer) {
        Offer holder = byDriver.putIfAbsent(offer.getDriverId(), offer);
        if (holder != null) {
            log.debug("Driver {} already holds offer {} (trip {})", offer.getDriverId(), holder.getOfferId(), holder.getTripId());
            return false;
        }
        if (byTrip.putIfAbsent(offer.getTripId(), offer) != null) {
            byDriver.remove(offer.getDriverId(), offer);
            log.warn("Trip {} already has an active offer, not offering to {}", offer.getTripId(), offer.getDriverId());
            return false;
        }
        return true;
    }

    public void release(Offer offer) {
        releaseTripSlot(offer);
        releaseDriverSlot(offer);
    }

    /**
     * Frees only the trip slot. An accepted offer keeps its driver slot until the assignment
     * is settled, so no other trip can reach the driver in between.
     */
    public void releaseTripSlot(Offer offer) {
        byTrip.remove(offer.getTripId(), offer);
    }

    public void releaseDriverSlot(Offer offer) {
        byDriver.remove(offer.getDriverId(), offer);
    }

    /**
     * Frees whatever offer the trip holds, together with its driver slot.
     */
    public Optional<Offer> releaseTrip(UUID tripId) {
        Offer offer = byTrip.remove(tripId);
        if (offer != null) {
            byDriver.remove(offer.getDriverId(), offer);
        }
        return Optional.ofNullable(offer);
    }

    public Optional<Offer> forTrip(UUID tripId) {
        return Optional.ofNullable(byTrip.get(tripId));
    }

    public Optional<Offer> forDriver(String driverId) {
        return Optional.ofNullable(byDriver.get(driverId));
    }

    /**
     * Applies a driver's answer to the trip's current offer. Answers that do not match the
     * pending offer (other driver, other offer id, already resolved) change nothing.
     */
    public OfferResponseOutcome respond(UUID tripId, String driverId, boolean accepted, String offerId) {
        Offer offer = byTrip.get(tripId);
        if (offer == null || !offer.getDriverId().equals(driverId)
                || (offerId != null && !offerId.equals(offer.getOfferId()))) {
            log.info("Ignoring response from driver {} for trip {}: no matching pending offer", driverId, tripId);
            return OfferResponseOutcome.IGNORED;
        }
        if (!offer.resolve(accepted ? OfferStatus.ACCEPTED : OfferStatus.REJECTED)) {
            log.info("Ignoring response from driver {} for trip {}: offer already {}", driverId, tripId, offer.getStatus());
            return OfferResponseOutcome.IGNORED;
        }
        return accepted ? OfferResponseOutcome.ACCEPTED : OfferResponseOutcome.REJECTED;
    }

    public int activeOffers() {
        return byTrip.size();
    }
}
