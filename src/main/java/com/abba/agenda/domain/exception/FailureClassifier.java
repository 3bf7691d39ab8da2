package com.abba.agenda.domain.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;

public final class FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureKind kind = classifyDirect(current);
            if (kind != FailureKind.UNKNOWN) {
                return kind;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return FailureKind.UNKNOWN;
    }

    private static FailureKind classifyDirect(Throwable error) {
        if (error instanceof CollaboratorException collaborator) {
            return collaborator.getKind();
        }
        if (error instanceof SchedulingException scheduling) {
            return scheduling.is(ErrorKind.LOCK_TIMEOUT) ? FailureKind.LOCK_CONTENTION : FailureKind.BUSINESS_REJECTION;
        }
        if (error instanceof DuplicateKeyException) {
            return FailureKind.DUPLICATE_KEY;
        }
        if (error instanceof OptimisticLockingFailureException) {
            return FailureKind.STALE_WRITE;
        }
        if (error instanceof QueryTimeoutException || error instanceof SocketTimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (error instanceof DataAccessResourceFailureException || error instanceof TransientDataAccessException) {
            return FailureKind.STORAGE_UNAVAILABLE;
        }
        if (error instanceof InterruptedIOException) {
            return FailureKind.TIMEOUT;
        }
        if (error instanceof IOException) {
            return FailureKind.NETWORK;
        }
        return FailureKind.UNKNOWN;
    }
}
