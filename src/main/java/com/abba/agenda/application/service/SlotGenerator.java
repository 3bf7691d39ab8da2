package com.abba.agenda.application.service;

import com.abba.agenda.domain.model.AvailabilitySlot;
import com.abba.agenda.domain.model.BreakWindow;
import com.abba.agenda.domain.model.DoctorSchedule;
import com.abba.agenda.domain.model.WallClock;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Carves a schedule's working day into candidate slots. No I/O.
 * <p>
 * Windows of {@code slotDuration} minutes are cut from the start time. A window that overlaps any
 * break is dropped whole, and so is a window that would end after the end time.
 */
@Component
public class SlotGenerator {

    public List<AvailabilitySlot> generate(DoctorSchedule schedule, LocalDate date) {
        if (schedule.getDayOfWeek() != null && date.getDayOfWeek() != schedule.getDayOfWeek()) {
            return List.of();
        }
        int duration = schedule.getSlotDuration();
        if (duration <= 0) {
            throw new IllegalArgumentException("Slot duration must be positive: " + duration);
        }
        int dayEnd = schedule.endMinute();
        List<AvailabilitySlot> slots = new ArrayList<>();
        for (int start = schedule.startMinute(); start + duration <= dayEnd; start += duration) {
            int end = start + duration;
            if (overlapsBreak(schedule.breaks(), start, end)) {
                continue;
            }
            slots.add(AvailabilitySlot.candidate(schedule, date, WallClock.fromMinutes(start), WallClock.fromMinutes(end)));
        }
        return slots;
    }

    private boolean overlapsBreak(List<BreakWindow> breaks, int start, int end) {
        for (BreakWindow window : breaks) {
            if (window.overlaps(start, end)) {
                return true;
            }
        }
        return false;
    }
}
