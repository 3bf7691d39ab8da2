package com.abba.agenda.application.dto;

import java.util.Optional;

/**
 * Result of a best-effort step: either a value or a {@link NonFatalError}, never an exception.
 */
public record StepOutcome<T>(T value, NonFatalError error) {

    public static <T> StepOutcome<T> success(T value) {
        return new StepOutcome<>(value, null);
    }

    public static <T> StepOutcome<T> failure(NonFatalError error) {
        return new StepOutcome<>(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public Optional<NonFatalError> failure() {
        return Optional.ofNullable(error);
    }
}
