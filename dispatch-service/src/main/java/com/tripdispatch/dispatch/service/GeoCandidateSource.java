package com.tripdispatch.dispatch.service;

import com.tripdispatch.dispatch.model.DriverCandidate;

import java.util.List;

/**
 * Nearby-driver lookup backed by a geospatial index.
 */
public interface GeoCandidateSource {

    /**
     * Available drivers within {@code radiusKm} of the point, nearest first, at most {@code limit}.
     * May throw on infrastructure failure; the matching loop treats that as "no candidates".
     */
    List<DriverCandidate> nearby(double lat, double lon, double radiusKm, int limit);
}
