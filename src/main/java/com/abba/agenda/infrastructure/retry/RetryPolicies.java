package com.abba.agenda.infrastructure.retry;

import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.infrastructure.config.RetryProperties;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Named policies shared by the orchestrators. Predicates match on {@link FailureKind} only.
 */
@Component
@Getter
public class RetryPolicies {

    static final Set<FailureKind> TRANSIENT_STORAGE = EnumSet.of(
            FailureKind.NETWORK, FailureKind.TIMEOUT, FailureKind.STORAGE_UNAVAILABLE, FailureKind.DUPLICATE_KEY);

    static final Set<FailureKind> TRANSPORT = EnumSet.of(
            FailureKind.NETWORK, FailureKind.TIMEOUT, FailureKind.UPSTREAM_5XX);

    static final Set<FailureKind> CONTENTION = EnumSet.of(
            FailureKind.LOCK_CONTENTION, FailureKind.STORAGE_UNAVAILABLE, FailureKind.NETWORK,
            FailureKind.TIMEOUT, FailureKind.DUPLICATE_KEY, FailureKind.STALE_WRITE);

    private final RetryPolicy storage;
    private final RetryPolicy payment;
    private final RetryPolicy notification;
    private final RetryPolicy booking;
    private final RetryPolicy cancellation;

    public RetryPolicies(RetryProperties properties) {
        this.storage = build("storage", properties.getStorage(), TRANSIENT_STORAGE);
        this.payment = build("payment", properties.getPayment(), TRANSPORT);
        this.notification = build("notification", properties.getNotification(), TRANSPORT);
        this.booking = build("booking", properties.getBooking(), CONTENTION);
        this.cancellation = build("cancellation", properties.getCancellation(), CONTENTION);
    }

    private static RetryPolicy build(String name, RetryProperties.Policy policy, Set<FailureKind> retryable) {
        return RetryPolicy.retryingOn(name, policy.getMaxRetries(), policy.getBaseDelay(), policy.getMaxDelay(), retryable);
    }
}
