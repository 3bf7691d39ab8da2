package com.abba.agenda.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BreakWindow {

    private String startTime;
    private String endTime;

    public int startMinute() {
        return WallClock.toMinutes(startTime);
    }

    public int endMinute() {
        return WallClock.toMinutes(endTime);
    }

    /**
     * Half-open overlap test against {@code [start, end)} expressed in minutes since midnight.
     */
    public boolean overlaps(int start, int end) {
        return start < endMinute() && end > startMinute();
    }
}
