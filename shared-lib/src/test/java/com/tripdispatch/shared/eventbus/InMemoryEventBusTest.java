package com.tripdispatch.shared.eventbus;

import com.tripdispatch.shared.events.DomainEvent;
import com.tripdispatch.shared.events.EventTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventBusTest {

    private InMemoryEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus(3);
    }

    @Test
    @DisplayName("Events are routed only to handlers of their own type")
    void routesByEventType() {
        List<String> received = new ArrayList<>();
        bus.subscribe(EventTypes.TRIP_CREATED, e -> received.add("created:" + e.getPayload().get("trip_id")));
        bus.subscribe(EventTypes.TRIP_CANCELLED, e -> received.add("cancelled"));

        bus.publish(DomainEvent.of(EventTypes.TRIP_CREATED, Map.of("trip_id", "t-1")));

        assertThat(received).containsExactly("created:t-1");
    }

    @Test
    @DisplayName("A handler that fails transiently is retried until it succeeds")
    void transientFailure_isRedelivered() {
        AtomicInteger attempts = new AtomicInteger();
        bus.subscribe(EventTypes.TRIP_CREATED, e -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("database unavailable");
            }
        });

        bus.publish(DomainEvent.of(EventTypes.TRIP_CREATED, Map.of()));

        assertThat(attempts).hasValue(3);
        assertThat(bus.getDeadLetters()).isEmpty();
    }

    @Test
    @DisplayName("After the delivery budget the event is dead-lettered and other handlers still run")
    void permanentFailure_isDeadLettered() {
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger healthy = new AtomicInteger();
        bus.subscribe(EventTypes.TRIP_EXPIRED, e -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        });
        bus.subscribe(EventTypes.TRIP_EXPIRED, e -> healthy.incrementAndGet());

        DomainEvent event = DomainEvent.of(EventTypes.TRIP_EXPIRED, Map.of());
        bus.publish(event);

        assertThat(attempts).hasValue(3);
        assertThat(healthy).hasValue(1);
        assertThat(bus.getDeadLetters()).containsExactly(event);
    }

    @Test
    @DisplayName("Malformed events are dead-lettered without retries")
    void malformedEvent_notRetried() {
        AtomicInteger attempts = new AtomicInteger();
        bus.subscribe(EventTypes.TRIP_CREATED, e -> {
            attempts.incrementAndGet();
            e.requireUuid("trip_id");
        });

        bus.publish(DomainEvent.of(EventTypes.TRIP_CREATED, Map.of()));

        assertThat(attempts).hasValue(1);
        assertThat(bus.getDeadLetters()).hasSize(1);
    }
}
