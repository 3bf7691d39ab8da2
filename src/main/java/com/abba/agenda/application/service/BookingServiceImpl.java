package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.BookingRequest;
import com.abba.agenda.application.dto.BookingResult;
import com.abba.agenda.application.dto.NonFatalError;
import com.abba.agenda.application.dto.NotificationResult;
import com.abba.agenda.application.dto.StepOutcome;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.AppointmentStatus;
import com.abba.agenda.domain.model.AvailabilitySlot;
import com.abba.agenda.domain.model.PaymentStatus;
import com.abba.agenda.domain.model.SlotAction;
import com.abba.agenda.domain.model.SlotChangeEvent;
import com.abba.agenda.domain.model.SlotStatus;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.repository.AppointmentRepository;
import com.abba.agenda.domain.repository.AvailabilitySlotRepository;
import com.abba.agenda.domain.repository.UserRepository;
import com.abba.agenda.domain.service.BookingService;
import com.abba.agenda.domain.service.LockService;
import com.abba.agenda.domain.service.NotificationService;
import com.abba.agenda.domain.service.PaymentGateway;
import com.abba.agenda.domain.service.SlotEventPublisher;
import com.abba.agenda.infrastructure.cache.ListingCache;
import com.abba.agenda.infrastructure.config.LockProperties;
import com.abba.agenda.infrastructure.config.PaymentProperties;
import com.abba.agenda.infrastructure.retry.RetryExecutor;
import com.abba.agenda.infrastructure.retry.RetryPolicies;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reserves a slot for a patient.
 * <p>
 * The reservation itself (idempotency lookup, slot checks, appointment insert, slot transition) runs
 * under the per-slot lock, and the slot transition is the last write inside it. Payment initiation,
 * notifications, the slot event and cache invalidation run after the lock is released and can only
 * add warnings to the result. Their outcome is written through {@link AppointmentUpdater}, so a
 * cancellation that lands in between is kept.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BookingServiceImpl implements BookingService {

    static final String SYSTEM_ACTOR = "system";

    private final AvailabilitySlotRepository slotRepository;
    private final AppointmentRepository appointmentRepository;
    private final AppointmentUpdater appointmentUpdater;
    private final UserRepository userRepository;
    private final LockService lockService;
    private final LockProperties lockProperties;
    private final RetryExecutor retryExecutor;
    private final RetryPolicies retryPolicies;
    private final PaymentGateway paymentGateway;
    private final PaymentProperties paymentProperties;
    private final NotificationService notificationService;
    private final SlotEventPublisher eventPublisher;
    private final ListingCache listingCache;
    private final AppointmentIdGenerator appointmentIdGenerator;
    private final Clock clock;

    @Override
    public BookingResult book(User patient, String slotId, BookingRequest request) {
        BookingRequest bookingRequest = request == null ? BookingRequest.empty() : request;
        Reservation reservation = retryExecutor.withRetry(retryPolicies.getBooking(),
                () -> lockService.withLock(
                        lockService.bookingLockKey(slotId),
                        lockProperties.getBookingTtlSeconds(),
                        () -> reserve(patient, slotId, bookingRequest),
                        lockProperties.getMaxRetries()));

        Appointment appointment = reservation.appointment();
        if (reservation.replayed()) {
            log.info("Booking replayed appointmentId={} patientId={} idempotencyKey={}",
                    appointment.getAppointmentId(), patient.getId(), bookingRequest.idempotencyKey());
            return BookingResult.replayed(appointment);
        }
        log.info("Slot booked slotId={} appointmentId={} patientId={}", slotId, appointment.getAppointmentId(), patient.getId());
        return completeBooking(appointment, reservation.slot(), bookingRequest);
    }

    private Reservation reserve(User patient, String slotId, BookingRequest request) {
        if (request.hasIdempotencyKey()) {
            var existing = appointmentRepository.findFirstByPatientIdAndIdempotencyKey(patient.getId(), request.idempotencyKey());
            if (existing.isPresent()) {
                return new Reservation(existing.get(), null, true);
            }
        }

        AvailabilitySlot slot = slotRepository.findById(slotId)
                .orElseThrow(() -> SchedulingException.notFound("Slot not found: " + slotId));
        if (slot.getStatus() != SlotStatus.AVAILABLE) {
            throw SchedulingException.invalidState("Slot is not available");
        }
        if (!slot.startDateTime().isAfter(LocalDateTime.now(clock))) {
            throw SchedulingException.invalidState("Cannot book past or current time slots");
        }
        if (appointmentRepository.existsByPatientIdAndDateAndStartTimeAndStatusIn(
                patient.getId(), slot.getDate(), slot.getStartTime(), AppointmentStatus.ACTIVE)) {
            throw SchedulingException.conflict("You already have a booking at this time");
        }

        User doctor = userRepository.findById(slot.getDoctorId()).orElse(null);
        BigDecimal fee = paymentGateway.calculateFee(doctor, request.bookingTypeOrDefault());

        Appointment draft = Appointment.forSlot(slot, appointmentIdGenerator.next(), patient.getId());
        draft.setBookingType(request.bookingTypeOrDefault());
        draft.setReason(request.reason() == null ? "" : request.reason());
        draft.setSymptoms(new ArrayList<>(request.normalizedSymptoms()));
        draft.setNotes(request.notes() == null ? "" : request.notes());
        draft.setIdempotencyKey(request.hasIdempotencyKey() ? request.idempotencyKey() : null);
        draft.getPayment().setAmount(fee);
        draft.getPayment().setCurrency(paymentProperties.getCurrency());
        draft.getPayment().setPaymentMethod(request.paymentMethodOrDefault());
        draft.setCreatedAt(OffsetDateTime.now(clock));
        draft.setUpdatedAt(draft.getCreatedAt());

        Appointment appointment = retryExecutor.withRetry(retryPolicies.getStorage(), () -> appointmentRepository.save(draft));

        slot.book(patient.getId(), appointment.getAppointmentId(), draft.getNotes(), OffsetDateTime.now(clock));
        try {
            AvailabilitySlot booked = retryExecutor.withRetry(retryPolicies.getStorage(), () -> slotRepository.save(slot));
            return new Reservation(appointment, booked, false);
        } catch (RuntimeException e) {
            discardOrphan(appointment, e);
            throw e;
        }
    }

    /**
     * The slot write failed after the appointment was stored. Cancel the orphan and drop its
     * idempotency key so neither the double-booking check nor a replay picks it up again.
     */
    private void discardOrphan(Appointment appointment, RuntimeException cause) {
        log.warn("Slot transition failed, cancelling orphan appointmentId={} error={}",
                appointment.getAppointmentId(), cause.getMessage());
        try {
            appointment.cancel(SYSTEM_ACTOR, "Slot reservation failed", OffsetDateTime.now(clock), BigDecimal.ZERO);
            appointment.setIdempotencyKey(null);
            retryExecutor.withRetry(retryPolicies.getStorage(), () -> appointmentRepository.save(appointment));
        } catch (RuntimeException compensationError) {
            cause.addSuppressed(compensationError);
            log.error("Could not cancel orphan appointmentId={}", appointment.getAppointmentId(), compensationError);
        }
    }

    private BookingResult completeBooking(Appointment appointment, AvailabilitySlot slot, BookingRequest request) {
        List<NonFatalError> warnings = new ArrayList<>();

        StepOutcome<PaymentGateway.PaymentInitiation> payment = retryExecutor.attempt("payment", retryPolicies.getPayment(),
                () -> paymentGateway.initiatePayment(appointment, request.paymentMethodOrDefault()));
        boolean paymentStarted = payment.succeeded() && payment.value().success();
        String paymentUrl = paymentStarted ? payment.value().paymentUrl() : null;
        if (!paymentStarted) {
            warnings.add(payment.failure()
                    .orElse(new NonFatalError("payment", FailureKind.BUSINESS_REJECTION, "Payment initiation was declined")));
        }

        StepOutcome<NotificationResult> notification = retryExecutor.attempt("notification", retryPolicies.getNotification(),
                () -> notificationService.sendBookingConfirmation(appointment));
        notification.failure().ifPresent(warnings::add);

        StepOutcome<Appointment> update = retryExecutor.attempt("appointment-update", retryPolicies.getBooking(),
                () -> appointmentUpdater.update(appointment, current -> {
                    if (paymentStarted && current.getPayment().getStatus() == PaymentStatus.PENDING
                            && current.getPayment().getTransactionId() == null) {
                        current.markPaymentInitiated(payment.value().transactionId(), paymentUrl);
                    }
                    if (notification.succeeded()) {
                        current.getNotifications().setEmailSent(notification.value().emailSent());
                        current.getNotifications().setSmsSent(notification.value().smsSent());
                    }
                }));
        update.failure().ifPresent(warnings::add);
        Appointment result = update.succeeded() ? update.value() : appointment;

        if (result.isActive()) {
            eventPublisher.publish(SlotChangeEvent.of(slot, SlotAction.BOOKED, result.getPatientId(),
                    result.getAppointmentId(), OffsetDateTime.now(clock)));
        } else {
            log.info("Appointment cancelled while booking completed appointmentId={} status={}",
                    result.getAppointmentId(), result.getStatus());
        }
        listingCache.invalidateSlots(slot.getDoctorId());

        return new BookingResult(result, false, !paymentStarted, paymentUrl, List.copyOf(warnings));
    }

    private record Reservation(Appointment appointment, AvailabilitySlot slot, boolean replayed) {
    }
}
