package com.abba.agenda.domain.exception;

import com.abba.agenda.application.dto.CancellationResult;
import lombok.Getter;

/**
 * The original appointment was cancelled but the replacement booking failed. The patient holds
 * neither slot and must re-book manually.
 */
@Getter
public class PartialRescheduleException extends SchedulingException {

    private final transient CancellationResult cancellation;

    public PartialRescheduleException(CancellationResult cancellation, Throwable cause) {
        super(ErrorKind.PARTIAL_RESCHEDULE_FAILURE,
                "Appointment " + cancellation.appointment().getAppointmentId()
                        + " was cancelled but the new booking failed: " + cause.getMessage(),
                cause);
        this.cancellation = cancellation;
    }
}
