package com.abba.agenda.domain.model;

import java.time.LocalTime;
import java.util.regex.Pattern;

/**
 * Minute-granularity 24-hour wall-clock strings ({@code HH:mm}).
 * Arithmetic goes through minutes since midnight, never through string comparison.
 */
public final class WallClock {

    private static final Pattern HH_MM = Pattern.compile("^([01]?[0-9]|2[0-3]):[0-5][0-9]$");
    public static final int MINUTES_PER_DAY = 24 * 60;

    private WallClock() {
    }

    public static boolean isValid(String value) {
        return value != null && HH_MM.matcher(value).matches();
    }

    public static int toMinutes(String value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Time must be in HH:mm format: " + value);
        }
        int separator = value.indexOf(':');
        int hours = Integer.parseInt(value.substring(0, separator));
        int minutes = Integer.parseInt(value.substring(separator + 1));
        return hours * 60 + minutes;
    }

    public static String fromMinutes(int minutes) {
        if (minutes < 0 || minutes >= MINUTES_PER_DAY) {
            throw new IllegalArgumentException("Minute of day out of range: " + minutes);
        }
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }

    public static LocalTime toLocalTime(String value) {
        return LocalTime.of(0, 0).plusMinutes(toMinutes(value));
    }
}
