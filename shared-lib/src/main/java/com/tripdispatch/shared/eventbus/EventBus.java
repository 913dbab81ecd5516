package com.tripdispatch.shared.eventbus;

import com.tripdispatch.shared.events.DomainEvent;

/**
 * Publish/subscribe contract between the trip lifecycle and dispatch components.
 *
 * Delivery is at-least-once: a handler that throws sees the event again, up to a bounded
 * number of attempts, after which the event is dead-lettered. Handlers must therefore be
 * idempotent (see {@link IdempotentEventHandler}).
 */
public interface EventBus {

    /**
     * Fire-and-forget. Transport failures are logged by the implementation, never thrown.
     */
    void publish(DomainEvent event);

    /**
     * Registers {@code handler} for every event whose type equals {@code eventType}.
     */
    void subscribe(String eventType, DomainEventHandler handler);
}
