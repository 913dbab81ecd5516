package com.tripdispatch.dispatch.service;

import com.tripdispatch.shared.eventbus.DomainEventHandler;
import com.tripdispatch.shared.eventbus.EventBus;
import com.tripdispatch.shared.events.DomainEvent;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Captures published events in order; subscriptions are ignored. A publish of one chosen
 * event type can be held back to simulate a slow broker.
 */
class RecordingEventBus implements EventBus {

    private final List<DomainEvent> published = new CopyOnWriteArrayList<>();

    private volatile String heldType;
    private final CountDownLatch heldEntered = new CountDownLatch(1);
    private final CountDownLatch heldRelease = new CountDownLatch(1);

    @Override
    public void publish(DomainEvent event) {
        if (event.getEventType().equals(heldType)) {
            heldEntered.countDown();
            try {
                heldRelease.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        published.add(event);
    }

    void holdPublishesOf(String eventType) {
        heldType = eventType;
    }

    boolean awaitHeldPublish() throws InterruptedException {
        return heldEntered.await(3, TimeUnit.SECONDS);
    }

    void releaseHeldPublishes() {
        heldRelease.countDown();
    }

    @Override
    public void subscribe(String eventType, DomainEventHandler handler) {
        throw new UnsupportedOperationException("RecordingEventBus does not deliver events");
    }

    List<String> typesFor(UUID tripId) {
        return published.stream()
                .filter(e -> tripId.toString().equals(e.getPayload().get("trip_id")))
                .map(DomainEvent::getEventType)
                .toList();
    }

    List<DomainEvent> ofType(String eventType) {
        return published.stream().filter(e -> e.getEventType().equals(eventType)).toList();
    }
}
