package com.abba.agenda.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Recurring weekly availability of a doctor for one weekday.
 */
@Document(collection = "doctor_schedules")
@CompoundIndex(name = "doctor_day_idx", def = "{'doctorId': 1, 'dayOfWeek': 1}", unique = true)
@Data
public class DoctorSchedule {

    @Id
    private String id;

    @Indexed
    private String doctorId;
    private DayOfWeek dayOfWeek;
    private String startTime;
    private String endTime;
    private int slotDuration = 30;
    private List<BreakWindow> breakTimes = new ArrayList<>();
    private boolean active = true;

    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public int startMinute() {
        return WallClock.toMinutes(startTime);
    }

    public int endMinute() {
        return WallClock.toMinutes(endTime);
    }

    public List<BreakWindow> breaks() {
        return breakTimes == null ? List.of() : breakTimes;
    }

    public void touch(OffsetDateTime at) {
        this.updatedAt = at;
    }
}
