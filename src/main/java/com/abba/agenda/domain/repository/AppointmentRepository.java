package com.abba.agenda.domain.repository;

import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.AppointmentStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends MongoRepository<Appointment, String> {

    Optional<Appointment> findFirstByPatientIdAndIdempotencyKey(String patientId, String idempotencyKey);

    boolean existsByPatientIdAndDateAndStartTimeAndStatusIn(
            String patientId, LocalDate date, String startTime, Collection<AppointmentStatus> statuses
    );

    Optional<Appointment> findByAppointmentIdAndPatientIdAndStatusIn(
            String appointmentId, String patientId, Collection<AppointmentStatus> statuses
    );

    Optional<Appointment> findByAppointmentIdAndPatientId(String appointmentId, String patientId);

    Optional<Appointment> findByAppointmentId(String appointmentId);

    List<Appointment> findByPatientIdOrderByDateDescStartTimeDesc(String patientId);

    List<Appointment> findByPatientIdAndStatusOrderByDateDescStartTimeDesc(String patientId, AppointmentStatus status);

    List<Appointment> findByDateAndStatusInAndNotificationsReminderSentFalse(
            LocalDate date, Collection<AppointmentStatus> statuses
    );
}
