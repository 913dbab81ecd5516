package com.tripdispatch.dispatch.exception;

/**
 * Error surfaced by the offer endpoints; {@code code} becomes the API error code.
 */
public class DispatchException extends RuntimeException {

    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String OFFER_NOT_ACTIVE = "OFFER_NOT_ACTIVE";

    private final String code;

    public DispatchException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static DispatchException noPendingOffer(String subject) {
        return new DispatchException(NOT_FOUND, subject + " has no pending offer");
    }

    public String getCode() {
        return code;
    }
}
