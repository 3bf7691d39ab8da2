package com.abba.agenda.domain.model;

import java.util.List;

public enum AppointmentStatus {
    PENDING,
    CONFIRMED,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    public static final List<AppointmentStatus> ACTIVE = List.of(PENDING, CONFIRMED);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
