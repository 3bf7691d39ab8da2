package com.abba.agenda.application.dto;

import java.time.LocalDate;

public record SlotGenerationRequest(
        String scheduleId,
        LocalDate startDate,
        LocalDate endDate,
        boolean overrideExisting
) {
}
