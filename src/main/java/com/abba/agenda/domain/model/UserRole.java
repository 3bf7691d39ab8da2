package com.abba.agenda.domain.model;

public enum UserRole {
    PATIENT,
    DOCTOR,
    STAFF,
    ADMIN
}
