package com.abba.agenda.domain.model;

public enum BookingType {
    ONLINE,
    WALK_IN
}
