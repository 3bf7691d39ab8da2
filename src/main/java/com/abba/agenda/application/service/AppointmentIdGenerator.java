package com.abba.agenda.application.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Public appointment references of the form {@code APT-<epochMillis>-<5 chars>}.
 */
@Component
public class AppointmentIdGenerator {

    private static final char[] ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();
    private static final int SUFFIX_LENGTH = 5;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public AppointmentIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return "APT-" + clock.millis() + "-" + suffix;
    }
}
