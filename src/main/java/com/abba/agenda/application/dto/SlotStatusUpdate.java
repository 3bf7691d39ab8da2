package com.abba.agenda.application.dto;

public record SlotStatusUpdate(String slotId, Action action, String reason) {

    public enum Action {
        BLOCK,
        UNBLOCK
    }
}
