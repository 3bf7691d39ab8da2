package com.abba.agenda.application.dto;

import com.abba.agenda.domain.model.AvailabilitySlot;

import java.util.List;

public record BulkSlotUpdateResult(
        int successCount,
        int errorCount,
        List<AvailabilitySlot> results,
        List<SlotUpdateError> errors
) {

    public record SlotUpdateError(String slotId, String error) {
    }
}
