package com.tripdispatch.shared.eventbus;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Registers the {@link EventBus} and {@link ProcessedEventStore} for every service that
 * includes shared-lib, selected by properties:
 *
 *   dispatch.events.transport   = kafka (default) | in-memory
 *   dispatch.events.dedup-store = redis (default) | in-memory
 *
 * Services only inject the interfaces; swapping transports needs no code change.
 */
@Slf4j
@AutoConfiguration(after = {KafkaAutoConfiguration.class, RedisAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {

    @Bean
    @ConditionalOnClass(KafkaTemplate.class)
    @ConditionalOnProperty(prefix = "dispatch.events", name = "transport", havingValue = "kafka", matchIfMissing = true)
    @ConditionalOnMissingBean(name = "eventBusErrorHandler")
    public DefaultErrorHandler eventBusErrorHandler(KafkaTemplate<String, String> kafkaTemplate,
                                                    EventBusProperties properties) {
        // maxDeliveryAttempts counts the first delivery, FixedBackOff counts only retries
        long retries = Math.max(0, properties.getMaxDeliveryAttempts() - 1);
        DefaultErrorHandler handler = new DefaultErrorHandler(
                new DeadLetterPublishingRecoverer(kafkaTemplate),
                new FixedBackOff(properties.getRedeliveryInterval().toMillis(), retries));
        handler.addNotRetryableExceptions(MalformedEventException.class);
        return handler;
    }

    @Bean
    @ConditionalOnClass(KafkaTemplate.class)
    @ConditionalOnProperty(prefix = "dispatch.events", name = "transport", havingValue = "kafka", matchIfMissing = true)
    @ConditionalOnMissingBean(EventBus.class)
    public EventBus kafkaEventBus(KafkaTemplate<String, String> kafkaTemplate,
                                  ConsumerFactory<String, String> consumerFactory,
                                  @Qualifier("eventBusErrorHandler") DefaultErrorHandler errorHandler,
                                  ObjectMapper objectMapper,
                                  EventBusProperties properties) {
        log.info("Event bus transport: kafka (group={})", properties.getConsumerGroup());
        return new KafkaEventBus(kafkaTemplate, consumerFactory, errorHandler, objectMapper,
                properties.getConsumerGroup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "dispatch.events", name = "transport", havingValue = "in-memory")
    @ConditionalOnMissingBean(EventBus.class)
    public EventBus inMemoryEventBus(EventBusProperties properties) {
        log.info("Event bus transport: in-memory");
        return new InMemoryEventBus(properties.getMaxDeliveryAttempts());
    }

    @Bean
    @ConditionalOnClass(RedisTemplate.class)
    @ConditionalOnProperty(prefix = "dispatch.events", name = "dedup-store", havingValue = "redis", matchIfMissing = true)
    @ConditionalOnMissingBean(ProcessedEventStore.class)
    public ProcessedEventStore redisProcessedEventStore(RedisTemplate<String, String> redisTemplate,
                                                        EventBusProperties properties) {
        return new RedisProcessedEventStore(redisTemplate, properties.getDedupTtl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "dispatch.events", name = "dedup-store", havingValue = "in-memory")
    @ConditionalOnMissingBean(ProcessedEventStore.class)
    public ProcessedEventStore inMemoryProcessedEventStore(EventBusProperties properties) {
        return new InMemoryProcessedEventStore(properties.getDedupTtl());
    }
}
