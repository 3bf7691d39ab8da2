package com.abba.agenda.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agenda.events")
@Data
public class EventProperties {

    private String slotChannel = "slot_updates";
}
