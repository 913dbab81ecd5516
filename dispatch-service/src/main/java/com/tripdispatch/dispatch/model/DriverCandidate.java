package com.tripdispatch.dispatch.model;

import lombok.Value;

/**
 * Nearby driver returned by the geo index for one search iteration.
 */
@Value(staticConstructor = "of")
public class DriverCandidate {

    String driverId;
    double distanceKm;
}
