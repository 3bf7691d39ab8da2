package com.abba.agenda.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agenda.slots")
@Data
public class SlotProperties {

    private int maxRangeDays = 90;
    private int minSlotDuration = 15;
    private int maxSlotDuration = 120;
    private int defaultSlotDuration = 30;
    private int listingDaysAhead = 7;
    private Duration listingCacheTtl = Duration.ofMinutes(5);
    private Duration scheduleCacheTtl = Duration.ofHours(1);
}
