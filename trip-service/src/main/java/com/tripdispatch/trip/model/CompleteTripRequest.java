package com.tripdispatch.trip.model;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CompleteTripRequest {

    /** Optional; the fare estimate is charged when absent. */
    @PositiveOrZero
    private BigDecimal finalFare;
}
