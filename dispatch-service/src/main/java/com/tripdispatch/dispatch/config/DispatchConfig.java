package com.tripdispatch.dispatch.config;

import com.tripdispatch.shared.events.EventTypes;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DispatchConfig {

    /**
     * One thread per running matching task. Tasks spend nearly all their time blocked on
     * offer responses, so the pool is sized by {@code max-concurrent-tasks}, not by CPU count.
     */
    @Bean(name = "matchingExecutor", destroyMethod = "shutdownNow")
    public ExecutorService matchingExecutor(MatchingProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("dispatch-match-");
        threadFactory.setDaemon(true);
        if (properties.getMaxConcurrentTasks() > 0) {
            return Executors.newFixedThreadPool(properties.getMaxConcurrentTasks(), threadFactory);
        }
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "dispatch.events", name = "transport", havingValue = "kafka", matchIfMissing = true)
    static class TopicConfig {

        /**
         * Event topics and their dead-letter twins, created on startup when missing.
         */
        @Bean
        public KafkaAdmin.NewTopics dispatchTopics(@Value("${dispatch.events.partitions:6}") int partitions,
                                                   @Value("${dispatch.events.replicas:1}") short replicas) {
            List<NewTopic> topics = new ArrayList<>();
            for (String type : EventTypes.ALL) {
                topics.add(TopicBuilder.name(type).partitions(partitions).replicas(replicas).build());
                topics.add(TopicBuilder.name(type + EventTypes.DEAD_LETTER_SUFFIX).partitions(partitions).replicas(replicas).build());
            }
            return new KafkaAdmin.NewTopics(topics.toArray(NewTopic[]::new));
        }
    }
}
