package com.tripdispatch.dispatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Custom Micrometer metrics for the Dispatch Service.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   dispatch_matching_total{outcome="started|matched|expired|cancelled|failed"}
 *   dispatch_offer_created_total
 *   dispatch_offer_response_total{outcome="accepted|rejected|expired"}
 *   dispatch_time_to_match_seconds{quantile="0.5|0.95|0.99"}   matching start to accepted trip
 *   dispatch_matching_active                                    running matching tasks
 */
@Component
public class DispatchMetrics {

    private final Counter matchingStartedCounter;
    private final Counter matchedCounter;
    private final Counter matchingExpiredCounter;
    private final Counter matchingCancelledCounter;
    private final Counter matchingFailedCounter;
    private final Counter offerCreatedCounter;
    private final Counter offerAcceptedCounter;
    private final Counter offerRejectedCounter;
    private final Counter offerExpiredCounter;
    private final Timer   timeToMatchTimer;
    private final AtomicInteger activeTasks = new AtomicInteger();

    public DispatchMetrics(MeterRegistry registry) {
        this.matchingStartedCounter = matching(registry, "started", "Matching tasks spawned");
        this.matchedCounter = matching(registry, "matched", "Trips matched to a driver");
        this.matchingExpiredCounter = matching(registry, "expired", "Trips expired without a driver");
        this.matchingCancelledCounter = matching(registry, "cancelled", "Matching tasks cancelled");
        this.matchingFailedCounter = matching(registry, "failed", "Matching aborted by infrastructure errors");

        this.offerCreatedCounter = Counter.builder("dispatch.offer.created")
                .description("Offers sent to drivers")
                .register(registry);

        this.offerAcceptedCounter = offerResponse(registry, "accepted", "Driver offers accepted");
        this.offerRejectedCounter = offerResponse(registry, "rejected", "Driver offers rejected");
        this.offerExpiredCounter = offerResponse(registry, "expired", "Driver offers timed out");

        this.timeToMatchTimer = Timer.builder("dispatch.time_to_match")
                .description("Time from matching start to an accepted trip")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofSeconds(1))
                .maximumExpectedValue(Duration.ofMinutes(10))
                .register(registry);

        Gauge.builder("dispatch.matching.active", activeTasks, AtomicInteger::get)
                .description("Matching tasks currently running")
                .register(registry);
    }

    private static Counter matching(MeterRegistry registry, String outcome, String description) {
        return Counter.builder("dispatch.matching")
                .tag("outcome", outcome)
                .description(description)
                .register(registry);
    }

    private static Counter offerResponse(MeterRegistry registry, String outcome, String description) {
        return Counter.builder("dispatch.offer.response")
                .tag("outcome", outcome)
                .description(description)
                .register(registry);
    }

    public void recordMatchingStarted()   { matchingStartedCounter.increment(); activeTasks.incrementAndGet(); }
    public void recordMatchingFinished()  { activeTasks.decrementAndGet(); }
    public void recordMatched(Duration d) { matchedCounter.increment(); timeToMatchTimer.record(d); }
    public void recordMatchingExpired()   { matchingExpiredCounter.increment(); }
    public void recordMatchingCancelled() { matchingCancelledCounter.increment(); }
    public void recordMatchingFailed()    { matchingFailedCounter.increment(); }
    public void recordOfferCreated()      { offerCreatedCounter.increment(); }
    public void recordOfferAccepted()     { offerAcceptedCounter.increment(); }
    public void recordOfferRejected()     { offerRejectedCounter.increment(); }
    public void recordOfferExpired()      { offerExpiredCounter.increment(); }
    public int activeTasks()              { return activeTasks.get(); }
}
