package com.tripdispatch.dispatch.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class OfferResponseRequest {

    @NotBlank
    private String driverId;

    @NotNull
    private Boolean accepted;

    /** When set, the response only counts for this exact offer. */
    private String offerId;
}
