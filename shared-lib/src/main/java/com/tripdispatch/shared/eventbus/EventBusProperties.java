package com.tripdispatch.shared.eventbus;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "dispatch.events")
public class EventBusProperties {

    /** kafka | in-memory */
    private String transport = "kafka";

    /** redis | in-memory */
    private String dedupStore = "redis";

    private String consumerGroup = "trip-dispatch";

    private Duration dedupTtl = Duration.ofHours(24);

    /** Includes the first delivery. */
    private int maxDeliveryAttempts = 3;

    private Duration redeliveryInterval = Duration.ofSeconds(1);
}
