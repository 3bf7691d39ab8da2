package com.abba.agenda.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WallClockTest {

    @Test
    void convertsBetweenLabelsAndMinutes() {
        assertEquals(0, WallClock.toMinutes("00:00"));
        assertEquals(9 * 60 + 5, WallClock.toMinutes("9:05"));
        assertEquals("13:45", WallClock.fromMinutes(13 * 60 + 45));
    }

    @Test
    void rejectsMalformedTimes() {
        assertFalse(WallClock.isValid("24:00"));
        assertFalse(WallClock.isValid("9am"));
        assertFalse(WallClock.isValid(null));
        assertThrows(IllegalArgumentException.class, () -> WallClock.toMinutes("12:60"));
    }

    @Test
    void comparesNumericallyNotLexically() {
        assertTrue(WallClock.toMinutes("9:30") < WallClock.toMinutes("10:00"));
    }
}
