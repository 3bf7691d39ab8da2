package com.abba.agenda.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agenda.notification")
@Data
public class NotificationProperties {

    private String mailFrom = "no-reply@agenda.local";
    private boolean smsEnabled = true;
    private String reminderCron = "0 0 18 * * *";
    private int reminderDaysAhead = 1;
}
