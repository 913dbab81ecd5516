package com.tripdispatch.dispatch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning of the per-trip matching loop (prefix {@code dispatch.matching}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "dispatch.matching")
public class MatchingProperties {

    /** First search radius. */
    @Positive
    private double minRadiusKm = 1.0;

    /** The loop stops once the radius grows past this. */
    @Positive
    private double maxRadiusKm = 10.0;

    @Positive
    private double radiusStepKm = 1.0;

    /** Number of empty search iterations before the trip expires. */
    @Min(1)
    private int maxRetries = 3;

    /** Candidates requested from the geo index per iteration. */
    @Min(1)
    private int maxCandidates = 10;

    @NotNull
    private Duration offerTimeout = Duration.ofSeconds(30);

    /** Pause after an iteration that produced no eligible candidate. */
    @NotNull
    private Duration retryBackoff = Duration.ofSeconds(5);

    /** Attempts for accept/expire writes before the trip is cancelled as a system error. */
    @Min(1)
    private int repositoryRetries = 3;

    @NotNull
    private Duration repositoryRetryBackoff = Duration.ofMillis(500);

    /** Upper bound on concurrently running tasks; 0 means unbounded. Excess tasks queue. */
    @Min(0)
    private int maxConcurrentTasks = 0;
}
