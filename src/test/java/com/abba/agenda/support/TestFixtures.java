package com.abba.agenda.support;

import com.abba.agenda.domain.model.AvailabilitySlot;
import com.abba.agenda.domain.model.BreakWindow;
import com.abba.agenda.domain.model.DoctorProfile;
import com.abba.agenda.domain.model.DoctorSchedule;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.model.UserRole;
import com.abba.agenda.infrastructure.config.LockProperties;
import com.abba.agenda.infrastructure.config.RetryProperties;
import com.abba.agenda.infrastructure.retry.RetryExecutor;
import com.abba.agenda.infrastructure.retry.RetryPolicies;
import com.abba.agenda.infrastructure.retry.Sleeper;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class TestFixtures {

    /**
     * Monday 2024-06-03 08:00 UTC.
     */
    public static final Instant NOW = Instant.parse("2024-06-03T08:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final LocalDate TODAY = LocalDate.of(2024, 6, 3);
    public static final Sleeper NO_SLEEP = duration -> {
    };

    private TestFixtures() {
    }

    public static RetryExecutor retryExecutor() {
        return new RetryExecutor(NO_SLEEP);
    }

    public static RetryPolicies retryPolicies() {
        return new RetryPolicies(new RetryProperties());
    }

    public static LockProperties lockProperties() {
        return new LockProperties();
    }

    public static User patient(String id) {
        User user = new User();
        user.setId(id);
        user.setName("Patient " + id);
        user.setEmail(id + "@example.com");
        user.setPhone("+15550000" + id.length());
        user.setRole(UserRole.PATIENT);
        return user;
    }

    public static User doctor(String id, String specialization, int experience) {
        User user = new User();
        user.setId(id);
        user.setName("Dr " + id);
        user.setEmail(id + "@clinic.example.com");
        user.setRole(UserRole.DOCTOR);
        DoctorProfile profile = new DoctorProfile();
        profile.setSpecialization(specialization);
        profile.setExperience(experience);
        profile.setHospital("General");
        user.setDoctorProfile(profile);
        return user;
    }

    public static User withRole(String id, UserRole role) {
        User user = new User();
        user.setId(id);
        user.setName(role + " " + id);
        user.setRole(role);
        return user;
    }

    public static DoctorSchedule schedule(String id, String doctorId, DayOfWeek day, String start, String end,
                                          int duration, BreakWindow... breaks) {
        DoctorSchedule schedule = new DoctorSchedule();
        schedule.setId(id);
        schedule.setDoctorId(doctorId);
        schedule.setDayOfWeek(day);
        schedule.setStartTime(start);
        schedule.setEndTime(end);
        schedule.setSlotDuration(duration);
        schedule.setBreakTimes(new ArrayList<>(List.of(breaks)));
        return schedule;
    }

    public static AvailabilitySlot slot(String id, String doctorId, LocalDate date, String start, String end) {
        AvailabilitySlot slot = new AvailabilitySlot();
        slot.setId(id);
        slot.setDoctorId(doctorId);
        slot.setScheduleId("schedule-1");
        slot.setDate(date);
        slot.setStartTime(start);
        slot.setEndTime(end);
        return slot;
    }

    public static AvailabilitySlot copy(AvailabilitySlot source) {
        AvailabilitySlot slot = slot(source.getId(), source.getDoctorId(), source.getDate(),
                source.getStartTime(), source.getEndTime());
        slot.setScheduleId(source.getScheduleId());
        slot.setStatus(source.getStatus());
        slot.setPatientId(source.getPatientId());
        slot.setAppointmentId(source.getAppointmentId());
        slot.setNotes(source.getNotes());
        slot.setBlockedBy(source.getBlockedBy());
        slot.setBlockedReason(source.getBlockedReason());
        slot.setVersion(source.getVersion());
        return slot;
    }
}
