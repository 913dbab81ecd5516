package com.tripdispatch.dispatch.service;

import com.tripdispatch.dispatch.model.Offer;
import com.tripdispatch.shared.events.DomainEvent;
import com.tripdispatch.shared.events.EventTypes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Domain events of the offer protocol.
 */
public final class OfferEvents {

    public static final String OFFER_ID    = "offer_id";
    public static final String TRIP_ID     = "trip_id";
    public static final String DRIVER_ID   = "driver_id";
    public static final String DISTANCE_KM = "distance_km";
    public static final String EXPIRES_AT  = "expires_at";
    public static final String STATUS      = "status";

    private OfferEvents() {}

    public static DomainEvent created(Offer offer) {
        Map<String, Object> payload = base(offer);
        payload.put(DISTANCE_KM, offer.getDistanceKm());
        payload.put(EXPIRES_AT, offer.getExpiresAt().toString());
        return DomainEvent.of(EventTypes.OFFER_CREATED, payload);
    }

    public static DomainEvent accepted(Offer offer) {
        return DomainEvent.of(EventTypes.OFFER_ACCEPTED, base(offer));
    }

    public static DomainEvent rejected(Offer offer) {
        return DomainEvent.of(EventTypes.OFFER_REJECTED, base(offer));
    }

    public static DomainEvent expired(Offer offer) {
        return DomainEvent.of(EventTypes.OFFER_EXPIRED, base(offer));
    }

    private static Map<String, Object> base(Offer offer) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(OFFER_ID, offer.getOfferId());
        payload.put(TRIP_ID, offer.getTripId().toString());
        payload.put(DRIVER_ID, offer.getDriverId());
        payload.put(STATUS, offer.getStatus().name());
        return payload;
    }
}
