package com.abba.agenda.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * Real-time notice that a slot changed state. Consumers use it to refresh listings; correctness
 * never depends on delivery.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlotChangeEvent(
        String slotId,
        String doctorId,
        String patientId,
        String appointmentId,
        SlotAction action,
        String status,
        OffsetDateTime timestamp
) {

    public static SlotChangeEvent of(AvailabilitySlot slot, SlotAction action, String patientId,
                                     String appointmentId, OffsetDateTime timestamp) {
        return new SlotChangeEvent(
                slot.getId(),
                slot.getDoctorId(),
                patientId,
                appointmentId,
                action,
                slot.getStatus() == null ? null : slot.getStatus().name().toLowerCase(Locale.ROOT),
                timestamp
        );
    }
}
