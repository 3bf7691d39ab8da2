package com.abba.agenda.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SlotAction {
    BOOKED,
    CANCELLED,
    BLOCKED,
    UNBLOCKED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
