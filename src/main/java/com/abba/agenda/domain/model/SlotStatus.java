package com.abba.agenda.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum SlotStatus {
    AVAILABLE,
    BOOKED,
    BLOCKED,
    CANCELLED;

    public boolean canTransitionTo(SlotStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<SlotStatus> allowedTargets() {
        return switch (this) {
            case AVAILABLE -> EnumSet.of(BOOKED, BLOCKED);
            case BLOCKED, BOOKED -> EnumSet.of(AVAILABLE);
            case CANCELLED -> EnumSet.noneOf(SlotStatus.class);
        };
    }
}
