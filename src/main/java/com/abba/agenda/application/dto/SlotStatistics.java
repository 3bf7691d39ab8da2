package com.abba.agenda.application.dto;

import com.abba.agenda.domain.model.SlotStatus;

import java.util.Map;

public record SlotStatistics(Map<SlotStatus, Long> statistics, long totalSlots) {
}
