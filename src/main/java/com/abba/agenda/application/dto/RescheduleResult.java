package com.abba.agenda.application.dto;

public record RescheduleResult(CancellationResult cancelled, BookingResult booked) {
}
