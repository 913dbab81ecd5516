package com.tripdispatch.dispatch;

import com.tripdispatch.dispatch.config.MatchingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = {"com.tripdispatch.dispatch", "com.tripdispatch.trip"})
@EnableJpaRepositories(basePackages = "com.tripdispatch.trip.repository")
@EntityScan(basePackages = "com.tripdispatch.trip.entity")
@EnableConfigurationProperties(MatchingProperties.class)
public class DispatchServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchServiceApplication.class, args);
    }
}
