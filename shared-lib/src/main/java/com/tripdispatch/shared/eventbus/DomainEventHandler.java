package com.tripdispatch.shared.eventbus;

import com.tripdispatch.shared.events.DomainEvent;

@FunctionalInterface
public interface DomainEventHandler {

    /**
     * Returning normally acknowledges the event; throwing asks the bus to redeliver it.
     */
    void handle(DomainEvent event) throws Exception;
}
