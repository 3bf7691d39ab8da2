package com.abba.agenda.domain.exception;

/**
 * Why a collaborator call failed. Retry predicates decide on this tag, not on message text.
 */
public enum FailureKind {
    NETWORK,
    TIMEOUT,
    STORAGE_UNAVAILABLE,
    DUPLICATE_KEY,
    STALE_WRITE,
    LOCK_CONTENTION,
    UPSTREAM_5XX,
    BUSINESS_REJECTION,
    UNKNOWN
}
