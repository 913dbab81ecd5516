package com.tripdispatch.trip.exception;

import com.tripdispatch.trip.service.TripOperationResult;

public class TripException extends RuntimeException {

    private final String code;

    public TripException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static TripException from(TripOperationResult rejection) {
        return new TripException(rejection.getOutcome().name(), rejection.getReason());
    }

    public String getCode() {
        return code;
    }
}
