package com.tripdispatch.dispatch.model;

public enum OfferResponseOutcome {
    ACCEPTED,
    REJECTED,
    /** No matching pending offer: stale, duplicate or addressed to another driver. */
    IGNORED
}
