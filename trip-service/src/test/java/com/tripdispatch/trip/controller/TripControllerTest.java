package com.tripdispatch.trip.controller;

import com.tripdispatch.shared.enums.TripActor;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.trip.entity.Trip;
import com.tripdispatch.trip.model.CreateTripRequest;
import com.tripdispatch.trip.service.TripLifecycleService;
import com.tripdispatch.trip.service.TripOperationResult;
import com.tripdispatch.trip.service.TripOperationResult.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TripControllerTest {

    @Mock private TripLifecycleService lifecycle;

    private MockMvc mockMvc;
    private UUID tripId;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TripController(lifecycle)).build();
        tripId = UUID.randomUUID();
    }

    private Trip trip(TripStatus status) {
        return Trip.builder().id(tripId).riderId("rider-1").status(status).pickupLat(40.7).pickupLng(-74.0).build();
    }

    @Test
    @DisplayName("POST /trips creates a trip and answers 201 with the PENDING trip")
    void createTrip() throws Exception {
        when(lifecycle.create(any(CreateTripRequest.class))).thenReturn(TripOperationResult.applied(trip(TripStatus.PENDING)));

        mockMvc.perform(post("/api/v1/trips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"riderId\":\"rider-1\",\"pickupLat\":40.7,\"pickupLng\":-74.0,\"fareEstimate\":12.5}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value(tripId.toString()))
                .andExpect(jsonPath("$.data.status").value("PENDING"));
    }

    @Test
    @DisplayName("A rider with an active trip gets 409 RULE_VIOLATION")
    void createTrip_activeTripConflict() throws Exception {
        when(lifecycle.create(any(CreateTripRequest.class)))
                .thenReturn(TripOperationResult.rejected(Outcome.RULE_VIOLATION, "Rider rider-1 already has an active trip"));

        mockMvc.perform(post("/api/v1/trips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"riderId\":\"rider-1\",\"pickupLat\":40.7,\"pickupLng\":-74.0}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("RULE_VIOLATION"));
    }

    @Test
    @DisplayName("Out-of-range coordinates are rejected before reaching the lifecycle")
    void createTrip_invalidCoordinates() throws Exception {
        mockMvc.perform(post("/api/v1/trips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"riderId\":\"rider-1\",\"pickupLat\":123.0,\"pickupLng\":-74.0}"))
                .andExpect(status().isBadRequest());

        verify(lifecycle, never()).create(any());
    }

    @Test
    @DisplayName("GET of an unknown trip is a 404")
    void getTrip_notFound() throws Exception {
        when(lifecycle.getTrip(tripId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/trips/{tripId}", tripId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("An invalid transition is a 400 INVALID_TRANSITION")
    void startRide_invalidTransition() throws Exception {
        when(lifecycle.startRide(tripId))
                .thenReturn(TripOperationResult.rejected(Outcome.INVALID_TRANSITION, "MATCHING -> IN_PROGRESS"));

        mockMvc.perform(post("/api/v1/trips/{tripId}/start", tripId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("Cancel passes actor and reason through")
    void cancelTrip() throws Exception {
        Trip cancelled = trip(TripStatus.CANCELLED);
        cancelled.setCancelledBy(TripActor.RIDER);
        when(lifecycle.cancel(tripId, TripActor.RIDER, "too_slow")).thenReturn(TripOperationResult.applied(cancelled));

        mockMvc.perform(post("/api/v1/trips/{tripId}/cancel", tripId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cancelledBy\":\"RIDER\",\"reason\":\"too_slow\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"))
                .andExpect(jsonPath("$.data.cancelledBy").value("RIDER"));
    }

    @Test
    @DisplayName("Complete without a body charges the estimate")
    void completeTrip_withoutBody() throws Exception {
        Trip completed = trip(TripStatus.COMPLETED);
        completed.setFinalFare(new BigDecimal("12.50"));
        when(lifecycle.complete(tripId, null)).thenReturn(TripOperationResult.applied(completed));

        mockMvc.perform(post("/api/v1/trips/{tripId}/complete", tripId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.finalFare").value(12.5));
    }

    @Test
    @DisplayName("Ratings outside 1-5 fail validation")
    void rateTrip_outOfRange() throws Exception {
        mockMvc.perform(post("/api/v1/trips/{tripId}/rate", tripId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ratedBy\":\"RIDER\",\"rating\":7}"))
                .andExpect(status().isBadRequest());

        verify(lifecycle, never()).rate(any(), any(), anyInt());
    }
}
