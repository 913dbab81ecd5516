package com.tripdispatch.shared.eventbus;

import com.tripdispatch.shared.events.DomainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Skips events this consumer already handled. An event is recorded only after the delegate
 * returns, so a failed attempt stays eligible for redelivery.
 */
@Slf4j
@RequiredArgsConstructor
public class IdempotentEventHandler implements DomainEventHandler {

    private final String consumer;
    private final ProcessedEventStore store;
    private final DomainEventHandler delegate;

    @Override
    public void handle(DomainEvent event) throws Exception {
        if (store.isProcessed(consumer, event.getEventId())) {
            log.info("Duplicate {} [{}] ignored by {}", event.getEventType(), event.getEventId(), consumer);
            return;
        }
        delegate.handle(event);
        store.markProcessed(consumer, event.getEventId());
    }
}
