package com.abba.agenda.application.dto;

import com.abba.agenda.domain.model.BreakWindow;

import java.time.DayOfWeek;
import java.util.List;

public record ScheduleRequest(
        DayOfWeek dayOfWeek,
        String startTime,
        String endTime,
        Integer slotDuration,
        List<BreakWindow> breakTimes
) {
}
