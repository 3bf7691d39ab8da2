package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.NotificationResult;
import com.abba.agenda.domain.exception.CollaboratorException;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.repository.UserRepository;
import com.abba.agenda.domain.service.NotificationService;
import com.abba.agenda.infrastructure.config.NotificationProperties;
import com.abba.agenda.infrastructure.notification.MailNotificationSender;
import com.abba.agenda.infrastructure.notification.SmsGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Mails and texts the patient and the doctor. A channel failing for one recipient does not stop
 * the others; the call only fails when every attempted delivery failed, so a retry never
 * duplicates a message that already went out.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationServiceImpl implements NotificationService {

    private final UserRepository userRepository;
    private final MailNotificationSender mailSender;
    private final SmsGateway smsGateway;
    private final NotificationProperties notificationProperties;

    @Override
    public NotificationResult sendBookingConfirmation(Appointment appointment) {
        return notifyBoth(appointment, "Appointment booked", "Your appointment %s on %s at %s is booked.");
    }

    @Override
    public NotificationResult sendCancellationNotification(Appointment appointment) {
        return notifyBoth(appointment, "Appointment cancelled", "Appointment %s on %s at %s was cancelled.");
    }

    @Override
    public NotificationResult sendAppointmentReminder(Appointment appointment) {
        return notifyBoth(appointment, "Appointment reminder", "Reminder: appointment %s on %s at %s.");
    }

    private NotificationResult notifyBoth(Appointment appointment, String subject, String smsTemplate) {
        Optional<User> patient = userRepository.findById(appointment.getPatientId());
        Optional<User> doctor = userRepository.findById(appointment.getDoctorId());
        Map<String, String> details = details(appointment, patient, doctor);
        String sms = String.format(smsTemplate, appointment.getAppointmentId(), appointment.getDate(), appointment.getStartTime());

        Delivery delivery = new Delivery();
        boolean patientEmail = delivery.attempt(patient.map(User::getEmail),
                email -> mailSender.send(email, subject, patient.get().getName(), details));
        boolean doctorEmail = delivery.attempt(doctor.map(User::getEmail),
                email -> mailSender.send(email, subject, doctor.get().getName(), details));
        boolean patientSms = notificationProperties.isSmsEnabled()
                && delivery.attempt(patient.map(User::getPhone), phone -> smsGateway.send(phone, sms));
        boolean doctorSms = notificationProperties.isSmsEnabled()
                && delivery.attempt(doctor.map(User::getPhone), phone -> smsGateway.send(phone, sms));

        if (delivery.attempted > 0 && delivery.failed == delivery.attempted) {
            throw delivery.lastError;
        }
        log.info("Notification '{}' appointmentId={} patientEmail={} doctorEmail={} patientSms={} doctorSms={}",
                subject, appointment.getAppointmentId(), patientEmail, doctorEmail, patientSms, doctorSms);
        return new NotificationResult(patientEmail, doctorEmail, patientSms, doctorSms);
    }

    private Map<String, String> details(Appointment appointment, Optional<User> patient, Optional<User> doctor) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("Appointment No", appointment.getAppointmentId());
        details.put("Patient", patient.map(User::getName).orElse("-"));
        details.put("Doctor", doctor.map(User::getName).orElse("-"));
        details.put("Date", String.valueOf(appointment.getDate()));
        details.put("Time", appointment.getStartTime() + " - " + appointment.getEndTime());
        details.put("Status", appointment.getStatus().name().toLowerCase(Locale.ROOT));
        return details;
    }

    private static final class Delivery {

        private int attempted;
        private int failed;
        private RuntimeException lastError;

        boolean attempt(Optional<String> address, Consumer<String> send) {
            if (address.isEmpty() || address.get().isBlank()) {
                return false;
            }
            attempted++;
            try {
                send.accept(address.get());
                return true;
            } catch (CollaboratorException e) {
                failed++;
                lastError = e;
                log.warn("Notification delivery failed kind={} error={}", e.getKind(), e.getMessage());
                return false;
            } catch (RuntimeException e) {
                failed++;
                lastError = new CollaboratorException(FailureKind.UNKNOWN, e.getMessage(), e);
                log.warn("Notification delivery failed error={}", e.getMessage());
                return false;
            }
        }
    }
}
