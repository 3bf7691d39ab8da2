package com.abba.agenda.application.dto;

import com.abba.agenda.domain.model.Appointment;

public record PaymentConfirmationResult(Appointment appointment, boolean alreadyConfirmed) {
}
