package com.abba.agenda.domain.exception;

import lombok.Getter;

/**
 * Failure of a scheduling operation, tagged with the kind the caller is expected to react to.
 */
@Getter
public class SchedulingException extends RuntimeException {

    private final ErrorKind kind;

    public SchedulingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SchedulingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static SchedulingException notFound(String message) {
        return new SchedulingException(ErrorKind.NOT_FOUND, message);
    }

    public static SchedulingException invalidState(String message) {
        return new SchedulingException(ErrorKind.INVALID_STATE, message);
    }

    public static SchedulingException conflict(String message) {
        return new SchedulingException(ErrorKind.CONFLICT, message);
    }

    public static SchedulingException invalidRange(String message) {
        return new SchedulingException(ErrorKind.INVALID_RANGE, message);
    }

    public static SchedulingException forbidden(String message) {
        return new SchedulingException(ErrorKind.FORBIDDEN, message);
    }

    public static SchedulingException lockTimeout(String key, int attempts) {
        return new SchedulingException(ErrorKind.LOCK_TIMEOUT,
                "Failed to acquire lock for key: " + key + " after " + attempts + " attempts");
    }

    public static SchedulingException upstreamFailure(String message, Throwable cause) {
        return new SchedulingException(ErrorKind.UPSTREAM_FAILURE, message, cause);
    }

    public boolean is(ErrorKind expected) {
        return kind == expected;
    }
}
