package com.tripdispatch.shared.eventbus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripdispatch.shared.events.DomainEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.Acknowledgment;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Kafka transport: one topic per event type, JSON string values, record key = trip id so
 * that all events of one trip land on the same partition in order.
 *
 * Consumption:
 *  1. One listener container per subscription, manual ack mode
 *  2. Record parsed into a {@link DomainEvent} and passed to the handler
 *  3. Offset acknowledged only after the handler returns
 *  4. A throwing handler leaves the record to the error handler, which redelivers it a
 *     bounded number of times and then publishes it to {@code <topic>.DLT}
 */
@Slf4j
public class KafkaEventBus implements EventBus, DisposableBean {

    private static final String PARTITION_KEY = "trip_id";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ConsumerFactory<String, String> consumerFactory;
    private final CommonErrorHandler errorHandler;
    private final ObjectMapper objectMapper;
    private final String consumerGroup;
    private final List<ConcurrentMessageListenerContainer<String, String>> containers = new CopyOnWriteArrayList<>();

    public KafkaEventBus(KafkaTemplate<String, String> kafkaTemplate,
                         ConsumerFactory<String, String> consumerFactory,
                         CommonErrorHandler errorHandler,
                         ObjectMapper objectMapper,
                         String consumerGroup) {
        this.kafkaTemplate = kafkaTemplate;
        this.consumerFactory = consumerFactory;
        this.errorHandler = errorHandler;
        this.objectMapper = objectMapper;
        this.consumerGroup = consumerGroup;
    }

    @Override
    public void publish(DomainEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize event {} [{}]: {}", event.getEventType(), event.getEventId(), e.getMessage());
            return;
        }
        Object key = event.getPayload().get(PARTITION_KEY);
        try {
            kafkaTemplate.send(event.getEventType(), key != null ? key.toString() : event.getEventId(), json)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Publish failed for {} [{}]: {}", event.getEventType(), event.getEventId(), ex.getMessage());
                        } else {
                            log.debug("Published {} [{}] to partition {}", event.getEventType(), event.getEventId(),
                                    result.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            // send() fails synchronously when metadata for the topic cannot be fetched
            log.warn("Publish failed for {} [{}]: {}", event.getEventType(), event.getEventId(), e.getMessage());
        }
    }

    @Override
    public void subscribe(String eventType, DomainEventHandler handler) {
        ContainerProperties props = new ContainerProperties(eventType);
        props.setGroupId(consumerGroup);
        props.setAckMode(ContainerProperties.AckMode.MANUAL);
        props.setMessageListener((AcknowledgingMessageListener<String, String>) (record, ack) ->
                onRecord(record, ack, handler));

        ConcurrentMessageListenerContainer<String, String> container =
                new ConcurrentMessageListenerContainer<>(consumerFactory, props);
        container.setCommonErrorHandler(errorHandler);
        container.setBeanName("event-bus-" + eventType);
        container.start();
        containers.add(container);
        log.info("Subscribed to topic {} as group {}", eventType, consumerGroup);
    }

    private void onRecord(ConsumerRecord<String, String> record, Acknowledgment ack, DomainEventHandler handler) {
        DomainEvent event = parse(record);
        try {
            handler.handle(event);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new EventHandlingException(event, e);
        }
        ack.acknowledge();
    }

    private DomainEvent parse(ConsumerRecord<String, String> record) {
        try {
            return objectMapper.readValue(record.value(), DomainEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException(
                    "Unparseable record on " + record.topic() + "@" + record.offset() + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void destroy() {
        containers.forEach(ConcurrentMessageListenerContainer::stop);
        containers.clear();
    }
}
