package com.abba.agenda.application.dto;

public record SlotGenerationResult(int slotsCount, String message) {

    public static SlotGenerationResult of(int slotsCount) {
        return new SlotGenerationResult(slotsCount, slotsCount + " slots generated successfully");
    }
}
