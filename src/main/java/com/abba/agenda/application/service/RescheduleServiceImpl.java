package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.BookingRequest;
import com.abba.agenda.application.dto.BookingResult;
import com.abba.agenda.application.dto.CancellationRequest;
import com.abba.agenda.application.dto.CancellationResult;
import com.abba.agenda.application.dto.RescheduleResult;
import com.abba.agenda.domain.exception.PartialRescheduleException;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.service.BookingService;
import com.abba.agenda.domain.service.CancellationService;
import com.abba.agenda.domain.service.RescheduleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cancel-then-book. The two steps are not atomic: when the new booking fails the original
 * appointment stays cancelled and a {@link PartialRescheduleException} tells the caller to re-book.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RescheduleServiceImpl implements RescheduleService {

    static final String CANCEL_REASON = "Rescheduled to different time";
    static final String DEFAULT_BOOKING_REASON = "Rescheduled appointment";

    private final CancellationService cancellationService;
    private final BookingService bookingService;

    @Override
    public RescheduleResult reschedule(User patient, String appointmentId, String newSlotId, BookingRequest request) {
        CancellationResult cancelled = cancellationService.cancel(patient, appointmentId, new CancellationRequest(CANCEL_REASON));

        BookingRequest base = request == null ? BookingRequest.empty() : request;
        BookingRequest booking = base.reason() == null || base.reason().isBlank()
                ? base.toBuilder().reason(DEFAULT_BOOKING_REASON).build()
                : base;
        try {
            BookingResult booked = bookingService.book(patient, newSlotId, booking);
            log.info("Appointment rescheduled from={} to={} patientId={}",
                    appointmentId, booked.appointment().getAppointmentId(), patient.getId());
            return new RescheduleResult(cancelled, booked);
        } catch (RuntimeException e) {
            log.error("Reschedule left patient without a slot appointmentId={} newSlotId={} patientId={}",
                    appointmentId, newSlotId, patient.getId(), e);
            throw new PartialRescheduleException(cancelled, e);
        }
    }
}
