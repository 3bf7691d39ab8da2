package com.abba.agenda.infrastructure.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * SMS transport that only writes the message to the log. Stands in until an SMS provider is wired.
 */
@Component
@Slf4j
public class LoggingSmsGateway implements SmsGateway {

    @Override
    public void send(String phone, String text) {
        log.info("SMS to={} text={}", mask(phone), text);
    }

    private String mask(String phone) {
        if (phone == null || phone.length() <= 4) {
            return "****";
        }
        return "*".repeat(phone.length() - 4) + phone.substring(phone.length() - 4);
    }
}
