package com.abba.agenda.application.dto;

import com.abba.agenda.domain.model.BreakWindow;

import java.util.List;

/**
 * Partial update of a schedule; {@code null} fields are left untouched.
 */
public record ScheduleUpdate(
        String startTime,
        String endTime,
        Integer slotDuration,
        List<BreakWindow> breakTimes,
        Boolean active
) {
}
