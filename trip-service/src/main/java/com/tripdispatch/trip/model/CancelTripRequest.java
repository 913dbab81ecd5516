package com.tripdispatch.trip.model;

import com.tripdispatch.shared.enums.TripActor;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CancelTripRequest {

    @NotNull
    private TripActor cancelledBy;

    @Size(max = 255)
    private String reason;
}
