package com.tripdispatch.trip.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Fare estimate and surge multiplier are computed upstream by pricing and stored as given.
 */
@Data
public class CreateTripRequest {

    @NotBlank
    private String riderId;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private double pickupLat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private double pickupLng;

    private String pickupAddress;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double dropoffLat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double dropoffLng;

    private String dropoffAddress;

    @PositiveOrZero
    private BigDecimal fareEstimate;

    private Double surgeMultiplier;

    @Size(min = 3, max = 3)
    private String currency;

    private String paymentMethod;

    @Size(max = 500)
    private String comment;
}
