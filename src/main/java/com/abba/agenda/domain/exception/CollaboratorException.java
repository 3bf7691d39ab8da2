package com.abba.agenda.domain.exception;

import lombok.Getter;

/**
 * Raised by payment, notification and cache adapters with the failure kind already decided.
 */
@Getter
public class CollaboratorException extends RuntimeException {

    private final FailureKind kind;

    public CollaboratorException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CollaboratorException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
