package com.abba.agenda.application.dto;

import com.abba.agenda.domain.model.BookingType;
import com.abba.agenda.domain.model.PaymentMethod;
import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record BookingRequest(
        String reason,
        List<String> symptoms,
        String notes,
        PaymentMethod paymentMethod,
        BookingType bookingType,
        String idempotencyKey
) {

    public static BookingRequest empty() {
        return BookingRequest.builder().build();
    }

    public PaymentMethod paymentMethodOrDefault() {
        return paymentMethod == null ? PaymentMethod.CARD : paymentMethod;
    }

    public BookingType bookingTypeOrDefault() {
        return bookingType == null ? BookingType.ONLINE : bookingType;
    }

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }

    public List<String> normalizedSymptoms() {
        if (symptoms == null) {
            return List.of();
        }
        return symptoms.stream()
                .filter(symptom -> symptom != null && !symptom.isBlank())
                .map(String::trim)
                .toList();
    }
}
