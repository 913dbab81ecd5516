package com.tripdispatch.trip.service;

import com.tripdispatch.shared.enums.TripStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TripStateMachineTest {

    private static final Map<TripStatus, Set<TripStatus>> EXPECTED = Map.of(
            TripStatus.PENDING, EnumSet.of(TripStatus.MATCHING, TripStatus.CANCELLED),
            TripStatus.MATCHING, EnumSet.of(TripStatus.ACCEPTED, TripStatus.CANCELLED, TripStatus.EXPIRED),
            TripStatus.ACCEPTED, EnumSet.of(TripStatus.DRIVER_ARRIVED, TripStatus.CANCELLED),
            TripStatus.DRIVER_ARRIVED, EnumSet.of(TripStatus.IN_PROGRESS, TripStatus.CANCELLED),
            TripStatus.IN_PROGRESS, EnumSet.of(TripStatus.COMPLETED, TripStatus.CANCELLED),
            TripStatus.COMPLETED, EnumSet.noneOf(TripStatus.class),
            TripStatus.CANCELLED, EnumSet.noneOf(TripStatus.class),
            TripStatus.EXPIRED, EnumSet.noneOf(TripStatus.class));

    @Test
    @DisplayName("Every (from, to) pair is allowed exactly when it is an edge of the lifecycle")
    void allPairs_matchTransitionTable() {
        for (TripStatus from : TripStatus.values()) {
            for (TripStatus to : TripStatus.values()) {
                assertThat(TripStateMachine.canTransition(from, to))
                        .as("%s -> %s", from, to)
                        .isEqualTo(EXPECTED.get(from).contains(to));
            }
        }
    }

    @Test
    @DisplayName("Terminal statuses have no outgoing transitions")
    void terminalStates_areFinal() {
        for (TripStatus status : TripStatus.values()) {
            assertThat(TripStateMachine.allowedTargets(status).isEmpty())
                    .as("%s", status)
                    .isEqualTo(status.isTerminal());
        }
    }

    @Test
    @DisplayName("EXPIRED is reachable only from MATCHING")
    void expired_onlyFromMatching() {
        for (TripStatus from : TripStatus.values()) {
            assertThat(TripStateMachine.canTransition(from, TripStatus.EXPIRED))
                    .isEqualTo(from == TripStatus.MATCHING);
        }
    }
}
