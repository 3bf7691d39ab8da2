package com.abba.agenda.application.dto;

import com.abba.agenda.domain.exception.FailureClassifier;
import com.abba.agenda.domain.exception.FailureKind;

/**
 * Failure of a best-effort step (payment, notification, refund) that did not fail the workflow.
 */
public record NonFatalError(String step, FailureKind kind, String message) {

    public static NonFatalError from(String step, Throwable error) {
        return new NonFatalError(step, FailureClassifier.classify(error), error.getMessage());
    }
}
