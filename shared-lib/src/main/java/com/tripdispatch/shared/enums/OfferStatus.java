package com.tripdispatch.shared.enums;

public enum OfferStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    EXPIRED,
    /** Withdrawn because the trip stopped matching while the offer was open. */
    CANCELLED
}
