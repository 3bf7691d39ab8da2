package com.abba.agenda.domain.model;

public enum RefundStatus {
    NONE,
    PENDING,
    PROCESSED,
    FAILED
}
