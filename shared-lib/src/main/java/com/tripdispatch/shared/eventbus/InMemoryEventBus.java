package com.tripdispatch.shared.eventbus;

import com.tripdispatch.shared.events.DomainEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single-process transport used by tests and local runs (dispatch.events.transport=in-memory).
 *
 * Handlers run synchronously on the publishing thread. A failing handler is retried up to
 * {@code maxDeliveryAttempts} times; after that the event is parked in the dead-letter list
 * and the remaining handlers still receive it.
 */
@Slf4j
public class InMemoryEventBus implements EventBus {

    private final ConcurrentMap<String, List<DomainEventHandler>> handlers = new ConcurrentHashMap<>();
    private final List<DomainEvent> deadLetters = new CopyOnWriteArrayList<>();
    private final int maxDeliveryAttempts;

    public InMemoryEventBus(int maxDeliveryAttempts) {
        if (maxDeliveryAttempts < 1) {
            throw new IllegalArgumentException("maxDeliveryAttempts must be >= 1");
        }
        this.maxDeliveryAttempts = maxDeliveryAttempts;
    }

    @Override
    public void publish(DomainEvent event) {
        List<DomainEventHandler> subscribed = handlers.getOrDefault(event.getEventType(), List.of());
        log.debug("Publishing {} [{}] to {} handler(s)", event.getEventType(), event.getEventId(), subscribed.size());
        for (DomainEventHandler handler : subscribed) {
            deliver(event, handler);
        }
    }

    @Override
    public void subscribe(String eventType, DomainEventHandler handler) {
        handlers.computeIfAbsent(eventType, t -> new CopyOnWriteArrayList<>()).add(handler);
        log.info("Subscribed handler to {}", eventType);
    }

    public List<DomainEvent> getDeadLetters() {
        return List.copyOf(deadLetters);
    }

    private void deliver(DomainEvent event, DomainEventHandler handler) {
        for (int attempt = 1; attempt <= maxDeliveryAttempts; attempt++) {
            try {
                handler.handle(event);
                return;
            } catch (MalformedEventException e) {
                log.error("Malformed event {} [{}], dead-lettering: {}",
                        event.getEventType(), event.getEventId(), e.getMessage());
                break;
            } catch (Exception e) {
                log.warn("Handler failed for {} [{}] (attempt {}/{}): {}",
                        event.getEventType(), event.getEventId(), attempt, maxDeliveryAttempts, e.getMessage());
            }
        }
        deadLetters.add(event);
        log.error("Event {} [{}] dead-lettered", event.getEventType(), event.getEventId());
    }
}
