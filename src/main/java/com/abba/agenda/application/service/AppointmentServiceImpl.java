package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.NotificationResult;
import com.abba.agenda.application.dto.PaymentConfirmationResult;
import com.abba.agenda.application.dto.StepOutcome;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.AppointmentStatus;
import com.abba.agenda.domain.model.PaymentMethod;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.repository.AppointmentRepository;
import com.abba.agenda.domain.service.AppointmentService;
import com.abba.agenda.domain.service.NotificationService;
import com.abba.agenda.domain.service.PaymentGateway;
import com.abba.agenda.infrastructure.config.NotificationProperties;
import com.abba.agenda.infrastructure.retry.RetryExecutor;
import com.abba.agenda.infrastructure.retry.RetryPolicies;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
@Slf4j
@RequiredArgsConstructor
public class AppointmentServiceImpl implements AppointmentService {

    private final AppointmentRepository appointmentRepository;
    private final AppointmentUpdater appointmentUpdater;
    private final PaymentGateway paymentGateway;
    private final NotificationService notificationService;
    private final NotificationProperties notificationProperties;
    private final RetryExecutor retryExecutor;
    private final RetryPolicies retryPolicies;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Override
    public Appointment getAppointment(User patient, String appointmentId) {
        return appointmentRepository.findByAppointmentIdAndPatientId(appointmentId, patient.getId())
                .orElseThrow(() -> SchedulingException.notFound("Appointment not found: " + appointmentId));
    }

    @Override
    public List<Appointment> listAppointments(User patient, AppointmentStatus status) {
        if (status == null) {
            return appointmentRepository.findByPatientIdOrderByDateDescStartTimeDesc(patient.getId());
        }
        return appointmentRepository.findByPatientIdAndStatusOrderByDateDescStartTimeDesc(patient.getId(), status);
    }

    @Override
    public PaymentConfirmationResult confirmPayment(User patient, String appointmentId, String transactionId, PaymentMethod method) {
        Appointment appointment = appointmentRepository
                .findByAppointmentIdAndPatientIdAndStatusIn(appointmentId, patient.getId(), AppointmentStatus.ACTIVE)
                .orElseThrow(() -> SchedulingException.notFound("Appointment not found: " + appointmentId));
        if (appointment.getPayment().isPaid()) {
            return new PaymentConfirmationResult(appointment, true);
        }
        String txId = transactionId == null || transactionId.isBlank()
                ? appointment.getPayment().getTransactionId()
                : transactionId;
        if (txId == null || txId.isBlank()) {
            throw SchedulingException.invalidRange("Transaction id is required");
        }

        PaymentGateway.PaymentConfirmation confirmation;
        try {
            confirmation = retryExecutor.withRetry(retryPolicies.getPayment(),
                    () -> paymentGateway.confirmPayment(appointment, txId));
        } catch (RuntimeException e) {
            throw SchedulingException.upstreamFailure("Payment confirmation failed", e);
        }
        if (!confirmation.paid()) {
            throw SchedulingException.upstreamFailure("Payment confirmation failed", null);
        }

        OffsetDateTime paidAt = confirmation.paidAt() == null ? OffsetDateTime.now(clock) : confirmation.paidAt();
        AtomicBoolean alreadyConfirmed = new AtomicBoolean(false);
        Appointment saved = retryExecutor.withRetry(retryPolicies.getBooking(),
                () -> appointmentUpdater.update(appointment, current -> recordPayment(current, txId, method, paidAt, alreadyConfirmed)));
        log.info("Payment confirmed appointmentId={} transactionId={}", appointmentId, txId);
        return new PaymentConfirmationResult(saved, alreadyConfirmed.get());
    }

    /**
     * A cancellation may have committed while the provider was confirming; the captured payment is
     * then left for reconciliation instead of reviving the appointment.
     */
    private void recordPayment(Appointment current, String txId, PaymentMethod method, OffsetDateTime paidAt,
                               AtomicBoolean alreadyConfirmed) {
        if (!current.isActive()) {
            log.warn("Payment captured for inactive appointment appointmentId={} status={} transactionId={}",
                    current.getAppointmentId(), current.getStatus(), txId);
            throw SchedulingException.invalidState("Appointment was cancelled before the payment was confirmed");
        }
        alreadyConfirmed.set(current.getPayment().isPaid());
        if (!alreadyConfirmed.get()) {
            current.markAsPaid(txId, method, paidAt);
        }
    }

    @Override
    public Appointment completeAppointment(User actor, String appointmentId) {
        Appointment appointment = appointmentRepository.findByAppointmentId(appointmentId)
                .orElseThrow(() -> SchedulingException.notFound("Appointment not found: " + appointmentId));
        accessPolicy.requireClinician(actor, appointment.getDoctorId());
        Appointment saved = retryExecutor.withRetry(retryPolicies.getBooking(),
                () -> appointmentUpdater.update(appointment, Appointment::complete));
        log.info("Appointment completed appointmentId={} actorId={}", appointmentId, actor.getId());
        return saved;
    }

    /**
     * Sends one reminder per active appointment on the reminder day. Appointments whose reminder
     * failed stay unflagged and are picked up by the next run.
     */
    @Override
    public int sendDueReminders() {
        LocalDate day = LocalDate.now(clock).plusDays(notificationProperties.getReminderDaysAhead());
        List<Appointment> due = appointmentRepository.findByDateAndStatusInAndNotificationsReminderSentFalse(
                day, AppointmentStatus.ACTIVE);
        int sent = 0;
        for (Appointment appointment : due) {
            StepOutcome<NotificationResult> outcome = retryExecutor.attempt("reminder", retryPolicies.getNotification(),
                    () -> notificationService.sendAppointmentReminder(appointment));
            if (!outcome.succeeded()) {
                continue;
            }
            if (retryExecutor.attempt("reminder-flag", retryPolicies.getBooking(),
                    () -> appointmentUpdater.update(appointment,
                            current -> current.getNotifications().setReminderSent(true))).succeeded()) {
                sent++;
            }
        }
        log.info("Reminders sent day={} due={} sent={}", day, due.size(), sent);
        return sent;
    }
}
