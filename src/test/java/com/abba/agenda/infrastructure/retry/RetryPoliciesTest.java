package com.abba.agenda.infrastructure.retry;

import com.abba.agenda.domain.exception.CollaboratorException;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.infrastructure.config.RetryProperties;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPoliciesTest {

    private final RetryPolicies policies = new RetryPolicies(new RetryProperties());

    @Test
    void storagePolicyRetriesTransientAndDuplicateKey() {
        RetryPolicy storage = policies.getStorage();

        assertEquals(3, storage.maxRetries());
        assertTrue(storage.retries(new DuplicateKeyException("dup")));
        assertTrue(storage.retries(new CollaboratorException(FailureKind.TIMEOUT, "slow")));
        assertFalse(storage.retries(SchedulingException.notFound("missing")));
        assertFalse(storage.retries(new OptimisticLockingFailureException("stale")));
    }

    @Test
    void paymentPolicyNeverRetriesBusinessRejection() {
        RetryPolicy payment = policies.getPayment();

        assertEquals(2, payment.maxRetries());
        assertTrue(payment.retries(new CollaboratorException(FailureKind.UPSTREAM_5XX, "503")));
        assertFalse(payment.retries(new CollaboratorException(FailureKind.BUSINESS_REJECTION, "insufficient funds")));
    }

    @Test
    void notificationPolicyWaitsLonger() {
        assertEquals(Duration.ofSeconds(2), policies.getNotification().baseDelay());
        assertEquals(2, policies.getNotification().maxRetries());
    }

    @Test
    void bookingPolicyRetriesContentionAndStaleWrites() {
        RetryPolicy booking = policies.getBooking();

        assertTrue(booking.retries(SchedulingException.lockTimeout("slot_booking_1", 3)));
        assertTrue(booking.retries(new OptimisticLockingFailureException("stale")));
        assertFalse(booking.retries(SchedulingException.invalidState("Slot is not available")));
        assertFalse(booking.retries(SchedulingException.conflict("double booking")));
    }

    @Test
    void delayDoublesUntilCap() {
        RetryPolicy policy = policies.getStorage();

        assertEquals(Duration.ofSeconds(1), policy.delayForAttempt(0));
        assertEquals(Duration.ofSeconds(4), policy.delayForAttempt(2));
        assertEquals(Duration.ofSeconds(30), policy.delayForAttempt(10));
        assertEquals(Duration.ofSeconds(30), policy.delayForAttempt(62));
    }
}
