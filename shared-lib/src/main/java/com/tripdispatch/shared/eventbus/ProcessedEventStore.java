package com.tripdispatch.shared.eventbus;

/**
 * Remembers which events a consumer has already handled, keyed by consumer name and event id.
 */
public interface ProcessedEventStore {

    boolean isProcessed(String consumer, String eventId);

    void markProcessed(String consumer, String eventId);
}
