package com.tripdispatch.trip.controller;

import com.tripdispatch.shared.dto.ApiResponse;
import com.tripdispatch.trip.entity.Trip;
import com.tripdispatch.trip.exception.TripException;
import com.tripdispatch.trip.model.CancelTripRequest;
import com.tripdispatch.trip.model.CompleteTripRequest;
import com.tripdispatch.trip.model.CreateTripRequest;
import com.tripdispatch.trip.model.RateTripRequest;
import com.tripdispatch.trip.service.TripLifecycleService;
import com.tripdispatch.trip.service.TripOperationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/trips")
@RequiredArgsConstructor
public class TripController {

    private final TripLifecycleService lifecycle;

    @PostMapping
    public ResponseEntity<ApiResponse<Trip>> createTrip(@Valid @RequestBody CreateTripRequest request) {
        Trip trip = unwrap(lifecycle.create(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(trip));
    }

    @GetMapping("/{tripId}")
    public ResponseEntity<ApiResponse<Trip>> getTrip(@PathVariable("tripId") UUID tripId) {
        Trip trip = lifecycle.getTrip(tripId)
                .orElseThrow(() -> new TripException("NOT_FOUND", "Trip " + tripId + " not found"));
        return ResponseEntity.ok(ApiResponse.ok(trip));
    }

    @GetMapping("/riders/{riderId}")
    public ResponseEntity<ApiResponse<List<Trip>>> getRiderTrips(@PathVariable("riderId") String riderId) {
        return ResponseEntity.ok(ApiResponse.ok(lifecycle.findTripsForRider(riderId)));
    }

    @GetMapping("/riders/{riderId}/active")
    public ResponseEntity<ApiResponse<Trip>> getActiveRiderTrip(@PathVariable("riderId") String riderId) {
        Trip trip = lifecycle.findActiveTripForRider(riderId)
                .orElseThrow(() -> new TripException("NOT_FOUND", "Rider " + riderId + " has no active trip"));
        return ResponseEntity.ok(ApiResponse.ok(trip));
    }

    @GetMapping("/drivers/{driverId}/active")
    public ResponseEntity<ApiResponse<Trip>> getActiveDriverTrip(@PathVariable("driverId") String driverId) {
        Trip trip = lifecycle.findActiveTripForDriver(driverId)
                .orElseThrow(() -> new TripException("NOT_FOUND", "Driver " + driverId + " has no active trip"));
        return ResponseEntity.ok(ApiResponse.ok(trip));
    }

    @PostMapping("/{tripId}/driver-arrived")
    public ResponseEntity<ApiResponse<Trip>> driverArrived(@PathVariable("tripId") UUID tripId) {
        return ResponseEntity.ok(ApiResponse.ok(unwrap(lifecycle.driverArrived(tripId))));
    }

    @PostMapping("/{tripId}/start")
    public ResponseEntity<ApiResponse<Trip>> startRide(@PathVariable("tripId") UUID tripId) {
        return ResponseEntity.ok(ApiResponse.ok(unwrap(lifecycle.startRide(tripId))));
    }

    @PostMapping("/{tripId}/complete")
    public ResponseEntity<ApiResponse<Trip>> completeTrip(
            @PathVariable("tripId") UUID tripId,
            @Valid @RequestBody(required = false) CompleteTripRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(unwrap(
                lifecycle.complete(tripId, request != null ? request.getFinalFare() : null))));
    }

    @PostMapping("/{tripId}/cancel")
    public ResponseEntity<ApiResponse<Trip>> cancelTrip(
            @PathVariable("tripId") UUID tripId,
            @Valid @RequestBody CancelTripRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(unwrap(
                lifecycle.cancel(tripId, request.getCancelledBy(), request.getReason()))));
    }

    @PostMapping("/{tripId}/rate")
    public ResponseEntity<ApiResponse<Trip>> rateTrip(
            @PathVariable("tripId") UUID tripId,
            @Valid @RequestBody RateTripRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(unwrap(
                lifecycle.rate(tripId, request.getRatedBy(), request.getRating()))));
    }

    @ExceptionHandler(TripException.class)
    public ResponseEntity<ApiResponse<Void>> handleTripException(TripException ex) {
        log.warn("Trip error [{}]: {}", ex.getCode(), ex.getMessage());
        HttpStatus status;
        switch (ex.getCode()) {
            case "NOT_FOUND":
                status = HttpStatus.NOT_FOUND;
                break;
            case "CONFLICT":
            case "RULE_VIOLATION":
                status = HttpStatus.CONFLICT;
                break;
            default:
                status = HttpStatus.BAD_REQUEST;
        }
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    private static Trip unwrap(TripOperationResult result) {
        if (!result.isApplied()) {
            throw TripException.from(result);
        }
        return result.getTrip().orElseThrow();
    }
}
