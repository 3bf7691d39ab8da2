package com.abba.agenda.domain.exception;

public enum ErrorKind {
    NOT_FOUND,
    INVALID_STATE,
    CONFLICT,
    INVALID_RANGE,
    FORBIDDEN,
    LOCK_TIMEOUT,
    UPSTREAM_FAILURE,
    PARTIAL_RESCHEDULE_FAILURE
}
