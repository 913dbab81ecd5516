package com.tripdispatch.dispatch.service;

import com.tripdispatch.dispatch.model.DriverCandidate;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drivers already tried for one trip. Owned by a single matching task, so not thread-safe.
 */
class ExclusionSet {

    private final Set<String> notified = new HashSet<>();
    private final Set<String> rejected = new HashSet<>();

    void markNotified(String driverId) {
        notified.add(driverId);
    }

    void markRejected(String driverId) {
        rejected.add(driverId);
    }

    boolean isExcluded(String driverId) {
        return notified.contains(driverId) || rejected.contains(driverId);
    }

    List<DriverCandidate> filter(List<DriverCandidate> candidates) {
        return candidates.stream()
                .filter(c -> !isExcluded(c.getDriverId()))
                .toList();
    }

    Set<String> rejected() {
        return Set.copyOf(rejected);
    }
}
