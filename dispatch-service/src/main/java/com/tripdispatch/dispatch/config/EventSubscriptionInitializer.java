package com.tripdispatch.dispatch.config;

import com.tripdispatch.dispatch.service.DispatchCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Subscribes the dispatch coordinator to trip events once the context is up, so no event
 * reaches a half-initialised matching engine.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class EventSubscriptionInitializer {

    private final DispatchCoordinator coordinator;

    @Bean
    public ApplicationRunner registerDispatchCoordinator() {
        return args -> {
            coordinator.register();
            log.info("Trip event subscriptions registered");
        };
    }
}
