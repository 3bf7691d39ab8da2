package com.abba.agenda.application.service;

import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.repository.AppointmentRepository;
import com.abba.agenda.domain.service.LockService;
import com.abba.agenda.infrastructure.config.LockProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.function.Consumer;

/**
 * Writes to an appointment after its booking or cancellation has left the slot lock.
 * <p>
 * The change is applied to a copy re-read under the same slot lock that booking and cancellation
 * hold, never to the caller's copy, so a status committed in between is seen by {@code change}.
 * The save is versioned; callers retry on a stale write, which re-reads again.
 */
@Component
@RequiredArgsConstructor
public class AppointmentUpdater {

    private final AppointmentRepository appointmentRepository;
    private final LockService lockService;
    private final LockProperties lockProperties;
    private final Clock clock;

    public Appointment update(Appointment appointment, Consumer<Appointment> change) {
        return lockService.withLock(
                lockService.bookingLockKey(appointment.getSlotId()),
                lockProperties.getDefaultTtlSeconds(),
                () -> {
                    Appointment current = appointmentRepository.findByAppointmentId(appointment.getAppointmentId())
                            .orElseThrow(() -> SchedulingException.notFound("Appointment not found: "
                                    + appointment.getAppointmentId()));
                    change.accept(current);
                    current.touch(OffsetDateTime.now(clock));
                    return appointmentRepository.save(current);
                },
                lockProperties.getMaxRetries());
    }
}
