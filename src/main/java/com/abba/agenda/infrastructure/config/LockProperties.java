package com.abba.agenda.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agenda.lock")
@Data
public class LockProperties {

    private String keyPrefix = "lock:";
    private long defaultTtlSeconds = 30;
    private long bookingTtlSeconds = 30;
    private int maxRetries = 3;
    private Duration baseDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofSeconds(5);
}
