package com.tripdispatch.dispatch.controller;

import com.tripdispatch.dispatch.model.DriverCandidate;
import com.tripdispatch.dispatch.model.Offer;
import com.tripdispatch.dispatch.model.OfferResponseOutcome;
import com.tripdispatch.dispatch.service.MatchingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DispatchControllerTest {

    @Mock private MatchingEngine matchingEngine;

    private MockMvc mockMvc;
    private UUID tripId;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new DispatchController(matchingEngine)).build();
        tripId = UUID.randomUUID();
    }

    @Test
    @DisplayName("POST respond returns the outcome of an accepted offer")
    void respond_accepted() throws Exception {
        when(matchingEngine.respond(tripId, "drv-1", true, null)).thenReturn(OfferResponseOutcome.ACCEPTED);

        mockMvc.perform(post("/api/v1/offers/{tripId}/respond", tripId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"driverId\":\"drv-1\",\"accepted\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").value("ACCEPTED"));
    }

    @Test
    @DisplayName("A response that matches no pending offer is a 409 OFFER_NOT_ACTIVE")
    void respond_ignoredIsConflict() throws Exception {
        when(matchingEngine.respond(tripId, "drv-1", false, "offer-9")).thenReturn(OfferResponseOutcome.IGNORED);

        mockMvc.perform(post("/api/v1/offers/{tripId}/respond", tripId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"driverId\":\"drv-1\",\"accepted\":false,\"offerId\":\"offer-9\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("OFFER_NOT_ACTIVE"));
    }

    @Test
    @DisplayName("A response without driverId fails validation and never reaches the engine")
    void respond_invalidBody() throws Exception {
        mockMvc.perform(post("/api/v1/offers/{tripId}/respond", tripId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accepted\":true}"))
                .andExpect(status().isBadRequest());

        verify(matchingEngine, never()).respond(any(), anyString(), anyBoolean(), any());
    }

    @Test
    @DisplayName("GET drivers/{id} shows the driver's pending offer")
    void currentOfferForDriver() throws Exception {
        Offer offer = Offer.create(tripId, DriverCandidate.of("drv-1", 1.25), Duration.ofSeconds(30));
        when(matchingEngine.currentOfferForDriver("drv-1")).thenReturn(Optional.of(offer));

        mockMvc.perform(get("/api/v1/offers/drivers/{driverId}", "drv-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.offerId").value(offer.getOfferId()))
                .andExpect(jsonPath("$.data.tripId").value(tripId.toString()))
                .andExpect(jsonPath("$.data.distanceKm").value(1.25))
                .andExpect(jsonPath("$.data.status").value("PENDING"));
    }

    @Test
    @DisplayName("GET trips/{id} without a pending offer is a 404")
    void currentOfferForTrip_none() throws Exception {
        when(matchingEngine.currentOfferForTrip(tripId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/offers/trips/{tripId}", tripId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }
}
