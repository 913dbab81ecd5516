package com.tripdispatch.dispatch.controller;

import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.model.OfferResponseOutcome;
import com.tripdispatch.dispatch.model.OfferResponseRequest;
import com.tripdispatch.dispatch.model.OfferView;
import com.tripdispatch.dispatch.service.MatchingEngine;
import com.tripdispatch.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/offers")
@RequiredArgsConstructor
public class DispatchController {

    private final MatchingEngine matchingEngine;

    /**
     * A driver's answer to the offer they hold for {@code tripId}. Late or mismatched answers
     * get 409 OFFER_NOT_ACTIVE and change nothing.
     */
    @PostMapping("/{tripId}/respond")
    public ResponseEntity<ApiResponse<OfferResponseOutcome>> respond(
            @PathVariable("tripId") UUID tripId,
            @Valid @RequestBody OfferResponseRequest request) {

        OfferResponseOutcome outcome = matchingEngine.respond(
                tripId, request.getDriverId(), request.getAccepted(), request.getOfferId());
        if (outcome == OfferResponseOutcome.IGNORED) {
            throw new DispatchException(DispatchException.OFFER_NOT_ACTIVE,
                    "Driver " + request.getDriverId() + " holds no pending offer for trip " + tripId);
        }
        return ResponseEntity.ok(ApiResponse.ok(outcome));
    }

    @GetMapping("/drivers/{driverId}")
    public ResponseEntity<ApiResponse<OfferView>> currentOfferForDriver(@PathVariable("driverId") String driverId) {
        OfferView offer = matchingEngine.currentOfferForDriver(driverId)
                .map(OfferView::from)
                .orElseThrow(() -> DispatchException.noPendingOffer("Driver " + driverId));
        return ResponseEntity.ok(ApiResponse.ok(offer));
    }

    @GetMapping("/trips/{tripId}")
    public ResponseEntity<ApiResponse<OfferView>> currentOfferForTrip(@PathVariable("tripId") UUID tripId) {
        OfferView offer = matchingEngine.currentOfferForTrip(tripId)
                .map(OfferView::from)
                .orElseThrow(() -> DispatchException.noPendingOffer("Trip " + tripId));
        return ResponseEntity.ok(ApiResponse.ok(offer));
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleDispatchException(DispatchException ex) {
        log.warn("Dispatch error [{}]: {}", ex.getCode(), ex.getMessage());
        HttpStatus status = switch (ex.getCode()) {
            case DispatchException.NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DispatchException.OFFER_NOT_ACTIVE -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }
}
