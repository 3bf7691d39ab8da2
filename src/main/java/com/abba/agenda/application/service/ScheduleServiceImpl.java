package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.ScheduleRequest;
import com.abba.agenda.application.dto.ScheduleUpdate;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.model.BreakWindow;
import com.abba.agenda.domain.model.DoctorSchedule;
import com.abba.agenda.domain.model.SlotStatus;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.model.WallClock;
import com.abba.agenda.domain.repository.AvailabilitySlotRepository;
import com.abba.agenda.domain.repository.DoctorScheduleRepository;
import com.abba.agenda.domain.service.ScheduleService;
import com.abba.agenda.infrastructure.cache.ListingCache;
import com.abba.agenda.infrastructure.config.SlotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduleServiceImpl implements ScheduleService {

    private static final List<SlotStatus> LIVE_SLOT_STATUSES = List.of(SlotStatus.AVAILABLE, SlotStatus.BOOKED);

    private final DoctorScheduleRepository scheduleRepository;
    private final AvailabilitySlotRepository slotRepository;
    private final ListingCache listingCache;
    private final AccessPolicy accessPolicy;
    private final SlotProperties slotProperties;
    private final Clock clock;

    @Override
    public DoctorSchedule createSchedule(User actor, String doctorId, ScheduleRequest request) {
        accessPolicy.requireScheduleOwner(actor, doctorId);
        if (request.dayOfWeek() == null) {
            throw SchedulingException.invalidRange("Day of week is required");
        }
        DoctorSchedule schedule = new DoctorSchedule();
        schedule.setDoctorId(doctorId);
        schedule.setDayOfWeek(request.dayOfWeek());
        schedule.setStartTime(request.startTime());
        schedule.setEndTime(request.endTime());
        schedule.setSlotDuration(request.slotDuration() == null
                ? slotProperties.getDefaultSlotDuration()
                : request.slotDuration());
        schedule.setBreakTimes(request.breakTimes() == null ? new ArrayList<>() : new ArrayList<>(request.breakTimes()));
        validate(schedule);
        schedule.setCreatedAt(OffsetDateTime.now(clock));
        schedule.setUpdatedAt(schedule.getCreatedAt());

        if (scheduleRepository.existsByDoctorIdAndDayOfWeek(doctorId, request.dayOfWeek())) {
            throw SchedulingException.conflict("Schedule already exists for " + request.dayOfWeek());
        }
        DoctorSchedule saved;
        try {
            saved = scheduleRepository.save(schedule);
        } catch (DuplicateKeyException e) {
            throw SchedulingException.conflict("Schedule already exists for " + request.dayOfWeek());
        }
        listingCache.invalidateSchedules(doctorId);
        log.info("Schedule created doctorId={} scheduleId={} day={}", doctorId, saved.getId(), saved.getDayOfWeek());
        return saved;
    }

    @Override
    public List<DoctorSchedule> listActiveSchedules(String doctorId) {
        return listingCache.getSchedules(doctorId).orElseGet(() -> {
            List<DoctorSchedule> schedules = scheduleRepository.findByDoctorIdAndActiveTrueOrderByDayOfWeekAsc(doctorId);
            listingCache.putSchedules(doctorId, schedules);
            return schedules;
        });
    }

    @Override
    public DoctorSchedule getSchedule(String doctorId, String scheduleId) {
        return scheduleRepository.findByIdAndDoctorId(scheduleId, doctorId)
                .orElseThrow(() -> SchedulingException.notFound("Schedule not found: " + scheduleId));
    }

    @Override
    public DoctorSchedule updateSchedule(User actor, String doctorId, String scheduleId, ScheduleUpdate update) {
        accessPolicy.requireScheduleOwner(actor, doctorId);
        DoctorSchedule schedule = getSchedule(doctorId, scheduleId);
        if (update.startTime() != null) {
            schedule.setStartTime(update.startTime());
        }
        if (update.endTime() != null) {
            schedule.setEndTime(update.endTime());
        }
        if (update.slotDuration() != null) {
            schedule.setSlotDuration(update.slotDuration());
        }
        if (update.breakTimes() != null) {
            schedule.setBreakTimes(new ArrayList<>(update.breakTimes()));
        }
        if (update.active() != null) {
            schedule.setActive(update.active());
        }
        validate(schedule);
        schedule.touch(OffsetDateTime.now(clock));
        DoctorSchedule saved = scheduleRepository.save(schedule);
        listingCache.invalidateSchedules(doctorId);
        log.info("Schedule updated doctorId={} scheduleId={} active={}", doctorId, scheduleId, saved.isActive());
        return saved;
    }

    @Override
    public void deleteSchedule(User actor, String doctorId, String scheduleId) {
        accessPolicy.requireScheduleOwner(actor, doctorId);
        DoctorSchedule schedule = getSchedule(doctorId, scheduleId);
        long liveSlots = slotRepository.countByScheduleIdAndDateGreaterThanEqualAndStatusIn(
                schedule.getId(), LocalDate.now(clock), LIVE_SLOT_STATUSES);
        if (liveSlots > 0) {
            throw SchedulingException.invalidState("Cannot delete schedule with " + liveSlots
                    + " upcoming slots; deactivate it instead");
        }
        scheduleRepository.delete(schedule);
        listingCache.invalidateSchedules(doctorId);
        log.info("Schedule deleted doctorId={} scheduleId={}", doctorId, scheduleId);
    }

    void validate(DoctorSchedule schedule) {
        requireTime("Start time", schedule.getStartTime());
        requireTime("End time", schedule.getEndTime());
        int start = schedule.startMinute();
        int end = schedule.endMinute();
        if (start >= end) {
            throw SchedulingException.invalidRange("Start time must be before end time");
        }
        int duration = schedule.getSlotDuration();
        if (duration < slotProperties.getMinSlotDuration() || duration > slotProperties.getMaxSlotDuration()) {
            throw SchedulingException.invalidRange("Slot duration must be between "
                    + slotProperties.getMinSlotDuration() + " and " + slotProperties.getMaxSlotDuration() + " minutes");
        }
        for (BreakWindow window : schedule.breaks()) {
            requireTime("Break start time", window.getStartTime());
            requireTime("Break end time", window.getEndTime());
            if (window.startMinute() >= window.endMinute()) {
                throw SchedulingException.invalidRange("Break start must be before break end");
            }
            if (window.startMinute() < start || window.endMinute() > end) {
                throw SchedulingException.invalidRange("Break " + window.getStartTime() + "-" + window.getEndTime()
                        + " is outside working hours");
            }
        }
    }

    private void requireTime(String label, String value) {
        if (!WallClock.isValid(value)) {
            throw SchedulingException.invalidRange(label + " must be in HH:mm format");
        }
    }
}
