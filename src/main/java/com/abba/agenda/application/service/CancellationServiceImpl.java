package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.CancellationRequest;
import com.abba.agenda.application.dto.CancellationResult;
import com.abba.agenda.application.dto.NonFatalError;
import com.abba.agenda.application.dto.NotificationResult;
import com.abba.agenda.application.dto.StepOutcome;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.AppointmentStatus;
import com.abba.agenda.domain.model.AvailabilitySlot;
import com.abba.agenda.domain.model.RefundStatus;
import com.abba.agenda.domain.model.SlotAction;
import com.abba.agenda.domain.model.SlotChangeEvent;
import com.abba.agenda.domain.model.SlotStatus;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.repository.AppointmentRepository;
import com.abba.agenda.domain.repository.AvailabilitySlotRepository;
import com.abba.agenda.domain.service.CancellationService;
import com.abba.agenda.domain.service.LockService;
import com.abba.agenda.domain.service.NotificationService;
import com.abba.agenda.domain.service.PaymentGateway;
import com.abba.agenda.domain.service.SlotEventPublisher;
import com.abba.agenda.infrastructure.cache.ListingCache;
import com.abba.agenda.infrastructure.config.CancellationProperties;
import com.abba.agenda.infrastructure.config.LockProperties;
import com.abba.agenda.infrastructure.retry.RetryExecutor;
import com.abba.agenda.infrastructure.retry.RetryPolicies;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancels a patient's appointment and frees its slot.
 * <p>
 * The cancellation window is checked before any lock or refund work. Under the slot lock the
 * appointment is cancelled first and the slot released second; a retry after a failed slot write
 * finds the appointment already cancelled and only finishes the release. Refund, notifications,
 * event and cache invalidation follow outside the lock and only add warnings. The slot event is only
 * published when this call released the slot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CancellationServiceImpl implements CancellationService {

    private final AppointmentRepository appointmentRepository;
    private final AppointmentUpdater appointmentUpdater;
    private final AvailabilitySlotRepository slotRepository;
    private final LockService lockService;
    private final LockProperties lockProperties;
    private final RetryExecutor retryExecutor;
    private final RetryPolicies retryPolicies;
    private final RefundPolicy refundPolicy;
    private final CancellationProperties cancellationProperties;
    private final PaymentGateway paymentGateway;
    private final NotificationService notificationService;
    private final SlotEventPublisher eventPublisher;
    private final ListingCache listingCache;
    private final Clock clock;

    @Override
    public CancellationResult cancel(User patient, String appointmentId, CancellationRequest request) {
        String reason = request == null ? CancellationRequest.DEFAULT_REASON : request.reasonOrDefault();
        Appointment current = appointmentRepository
                .findByAppointmentIdAndPatientIdAndStatusIn(appointmentId, patient.getId(), AppointmentStatus.ACTIVE)
                .orElseThrow(() -> SchedulingException.notFound("Appointment not found: " + appointmentId));
        requireWithinWindow(current);

        AtomicBoolean cancelledHere = new AtomicBoolean(false);
        Released released = retryExecutor.withRetry(retryPolicies.getCancellation(),
                () -> lockService.withLock(
                        lockService.bookingLockKey(current.getSlotId()),
                        lockProperties.getDefaultTtlSeconds(),
                        () -> cancelUnderLock(patient, appointmentId, reason, cancelledHere),
                        lockProperties.getMaxRetries()));

        Appointment appointment = released.appointment();
        log.info("Appointment cancelled appointmentId={} patientId={} refundAmount={}",
                appointmentId, patient.getId(), appointment.getCancellation().getRefundAmount());
        return finish(released);
    }

    private void requireWithinWindow(Appointment appointment) {
        Duration notice = Duration.between(LocalDateTime.now(clock), appointment.startDateTime());
        if (notice.compareTo(Duration.ofHours(cancellationProperties.getCutoffHours())) < 0) {
            throw SchedulingException.invalidState("Appointments can only be cancelled at least "
                    + cancellationProperties.getCutoffHours() + " hours in advance");
        }
    }

    /**
     * {@code cancelledHere} survives retries of this call: an appointment found already cancelled is
     * only resumed when this call cancelled it, otherwise another request got there first.
     */
    private Released cancelUnderLock(User patient, String appointmentId, String reason, AtomicBoolean cancelledHere) {
        Appointment appointment = appointmentRepository.findByAppointmentIdAndPatientId(appointmentId, patient.getId())
                .orElseThrow(() -> SchedulingException.notFound("Appointment not found: " + appointmentId));

        if (appointment.isActive()) {
            requireWithinWindow(appointment);
            Duration notice = Duration.between(LocalDateTime.now(clock), appointment.startDateTime());
            BigDecimal refund = appointment.getPayment().isPaid()
                    ? refundPolicy.refundAmount(appointment.getPayment().getAmount(), notice)
                    : BigDecimal.ZERO;
            appointment.cancel(patient.getId(), reason, OffsetDateTime.now(clock), refund);
            Appointment cancelled = appointment;
            appointment = retryExecutor.withRetry(retryPolicies.getStorage(), () -> appointmentRepository.save(cancelled));
            cancelledHere.set(true);
        } else if (!cancelledHere.get()) {
            throw SchedulingException.notFound("Appointment not found: " + appointmentId);
        }

        AvailabilitySlot slot = slotRepository.findById(appointment.getSlotId()).orElse(null);
        if (slot == null || slot.getStatus() != SlotStatus.BOOKED
                || !Objects.equals(slot.getAppointmentId(), appointment.getAppointmentId())) {
            log.warn("Slot not released appointmentId={} slotId={} slotStatus={}", appointmentId,
                    appointment.getSlotId(), slot == null ? null : slot.getStatus());
            return new Released(appointment, slot, false);
        }
        slot.release(OffsetDateTime.now(clock));
        AvailabilitySlot released = retryExecutor.withRetry(retryPolicies.getStorage(), () -> slotRepository.save(slot));
        return new Released(appointment, released, true);
    }

    private CancellationResult finish(Released released) {
        Appointment appointment = released.appointment();
        List<NonFatalError> warnings = new ArrayList<>();
        BigDecimal refundAmount = appointment.getCancellation().getRefundAmount() == null
                ? BigDecimal.ZERO
                : appointment.getCancellation().getRefundAmount();

        boolean refundAttempted = appointment.getCancellation().getRefundStatus() == RefundStatus.PENDING;
        boolean refundProcessed = false;
        if (refundAttempted) {
            StepOutcome<PaymentGateway.RefundData> refund = retryExecutor.attempt("refund", retryPolicies.getPayment(),
                    () -> paymentGateway.processRefund(appointment, refundAmount));
            refundProcessed = refund.succeeded() && refund.value().success();
            if (!refundProcessed) {
                warnings.add(refund.failure()
                        .orElse(new NonFatalError("refund", FailureKind.BUSINESS_REJECTION, "Refund was declined")));
            }
        }

        StepOutcome<NotificationResult> notification = retryExecutor.attempt("notification", retryPolicies.getNotification(),
                () -> notificationService.sendCancellationNotification(appointment));
        notification.failure().ifPresent(warnings::add);

        boolean processed = refundProcessed;
        StepOutcome<Appointment> update = retryExecutor.attempt("appointment-update", retryPolicies.getCancellation(),
                () -> appointmentUpdater.update(appointment, current -> {
                    if (refundAttempted && current.getCancellation().getRefundStatus() == RefundStatus.PENDING) {
                        current.markRefunded(processed);
                    }
                    if (notification.succeeded()) {
                        current.getNotifications().setEmailSent(notification.value().emailSent());
                        current.getNotifications().setSmsSent(notification.value().smsSent());
                    }
                }));
        Appointment result;
        if (update.succeeded()) {
            result = update.value();
        } else {
            warnings.add(update.error());
            result = appointment;
            if (refundAttempted) {
                result.markRefunded(refundProcessed);
            }
        }

        if (released.slotReleased()) {
            eventPublisher.publish(SlotChangeEvent.of(released.slot(), SlotAction.CANCELLED, result.getPatientId(),
                    result.getAppointmentId(), OffsetDateTime.now(clock)));
        }
        listingCache.invalidateSlots(result.getDoctorId());

        return new CancellationResult(result, refundAmount, result.getCancellation().getRefundStatus(),
                refundProcessed, List.copyOf(warnings));
    }

    private record Released(Appointment appointment, AvailabilitySlot slot, boolean slotReleased) {
    }
}
