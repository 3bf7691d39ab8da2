package com.abba.agenda.domain.model;

import com.abba.agenda.domain.exception.SchedulingException;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

@Document(collection = "availability_slots")
@CompoundIndexes({
        @CompoundIndex(name = "slot_unique_idx", def = "{'doctorId': 1, 'scheduleId': 1, 'date': 1, 'startTime': 1}", unique = true),
        @CompoundIndex(name = "doctor_status_idx", def = "{'doctorId': 1, 'status': 1}"),
        @CompoundIndex(name = "date_status_idx", def = "{'date': 1, 'status': 1}")
})
@Data
public class AvailabilitySlot {

    @Id
    private String id;

    private String doctorId;
    private String scheduleId;
    private LocalDate date;
    private String startTime;
    private String endTime;

    private SlotStatus status = SlotStatus.AVAILABLE;
    private String patientId;
    private String appointmentId;
    private String notes;
    private String blockedBy;
    private String blockedReason;

    @Version
    private Long version;

    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static AvailabilitySlot candidate(DoctorSchedule schedule, LocalDate date, String startTime, String endTime) {
        AvailabilitySlot slot = new AvailabilitySlot();
        slot.setDoctorId(schedule.getDoctorId());
        slot.setScheduleId(schedule.getId());
        slot.setDate(date);
        slot.setStartTime(startTime);
        slot.setEndTime(endTime);
        return slot;
    }

    public LocalDateTime startDateTime() {
        return date.atTime(WallClock.toLocalTime(startTime));
    }

    public void book(String patientId, String appointmentId, String notes, OffsetDateTime at) {
        transitionTo(SlotStatus.BOOKED, "Slot is not available", at);
        this.patientId = patientId;
        this.appointmentId = appointmentId;
        this.notes = notes;
    }

    public void release(OffsetDateTime at) {
        if (status != SlotStatus.BOOKED) {
            throw SchedulingException.invalidState("Slot is not booked");
        }
        transitionTo(SlotStatus.AVAILABLE, "Slot is not booked", at);
        this.patientId = null;
        this.appointmentId = null;
        this.notes = null;
    }

    public void block(String actorId, String reason, OffsetDateTime at) {
        if (status == SlotStatus.BOOKED) {
            throw SchedulingException.invalidState("Cannot block a booked slot");
        }
        transitionTo(SlotStatus.BLOCKED, "Slot is already blocked", at);
        this.blockedBy = actorId;
        this.blockedReason = reason;
    }

    public void unblock(OffsetDateTime at) {
        if (status != SlotStatus.BLOCKED) {
            throw SchedulingException.invalidState("Slot is not blocked");
        }
        transitionTo(SlotStatus.AVAILABLE, "Slot is not blocked", at);
        this.blockedBy = null;
        this.blockedReason = null;
    }

    private void transitionTo(SlotStatus target, String rejection, OffsetDateTime at) {
        if (status == null || !status.canTransitionTo(target)) {
            throw SchedulingException.invalidState(rejection);
        }
        this.status = target;
        this.updatedAt = at;
    }
}
