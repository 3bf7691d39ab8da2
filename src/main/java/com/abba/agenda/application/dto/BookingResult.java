package com.abba.agenda.application.dto;

import com.abba.agenda.domain.model.Appointment;

import java.util.List;

public record BookingResult(
        Appointment appointment,
        boolean replayed,
        boolean paymentRequired,
        String paymentUrl,
        List<NonFatalError> warnings
) {

    public static BookingResult replayed(Appointment appointment) {
        return new BookingResult(appointment, true, !appointment.getPayment().isPaid(),
                appointment.getPayment().getPaymentUrl(), List.of());
    }
}
