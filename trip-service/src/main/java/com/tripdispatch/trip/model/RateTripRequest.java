package com.tripdispatch.trip.model;

import com.tripdispatch.shared.enums.TripActor;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RateTripRequest {

    @NotNull
    private TripActor ratedBy;

    @Min(1) @Max(5)
    private int rating;
}
