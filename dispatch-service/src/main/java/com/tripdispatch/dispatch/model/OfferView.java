package com.tripdispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.tripdispatch.shared.enums.OfferStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class OfferView {

    private String offerId;
    private UUID tripId;
    private String driverId;
    private double distanceKm;
    private OfferStatus status;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiresAt;

    public static OfferView from(Offer offer) {
        return OfferView.builder()
                .offerId(offer.getOfferId())
                .tripId(offer.getTripId())
                .driverId(offer.getDriverId())
                .distanceKm(offer.getDistanceKm())
                .status(offer.getStatus())
                .createdAt(offer.getCreatedAt())
                .expiresAt(offer.getExpiresAt())
                .build();
    }
}
