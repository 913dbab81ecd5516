package com.tripdispatch.shared.eventbus;

import com.tripdispatch.shared.events.DomainEvent;

/**
 * Wraps a checked exception thrown by a {@link DomainEventHandler} so the transport can retry it.
 */
public class EventHandlingException extends RuntimeException {

    public EventHandlingException(DomainEvent event, Throwable cause) {
        super("Handler failed for " + event.getEventType() + " [" + event.getEventId() + "]", cause);
    }
}
