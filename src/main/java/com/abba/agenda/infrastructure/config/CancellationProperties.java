package com.abba.agenda.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agenda.cancellation")
@Data
public class CancellationProperties {

    private int cutoffHours = 2;
    private int fullRefundHours = 24;
    private int partialRefundPercent = 50;
}
