package com.abba.agenda.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agenda.retry")
@Data
public class RetryProperties {

    private Policy storage = new Policy(3, Duration.ofSeconds(1), Duration.ofSeconds(30));
    private Policy payment = new Policy(2, Duration.ofSeconds(1), Duration.ofSeconds(30));
    private Policy notification = new Policy(2, Duration.ofSeconds(2), Duration.ofSeconds(30));
    private Policy booking = new Policy(3, Duration.ofSeconds(1), Duration.ofSeconds(30));
    private Policy cancellation = new Policy(3, Duration.ofSeconds(1), Duration.ofSeconds(30));

    @Data
    public static class Policy {

        private int maxRetries;
        private Duration baseDelay;
        private Duration maxDelay;

        public Policy() {
        }

        public Policy(int maxRetries, Duration baseDelay, Duration maxDelay) {
            this.maxRetries = maxRetries;
            this.baseDelay = baseDelay;
            this.maxDelay = maxDelay;
        }
    }
}
