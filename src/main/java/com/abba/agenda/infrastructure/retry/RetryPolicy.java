package com.abba.agenda.infrastructure.retry;

import com.abba.agenda.domain.exception.FailureClassifier;
import com.abba.agenda.domain.exception.FailureKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Bounded retry with capped exponential backoff: the delay before retry {@code n} (zero based) is
 * {@code min(baseDelay * 2^n, maxDelay)}.
 */
public record RetryPolicy(
        String name,
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        Predicate<Throwable> shouldRetry
) {

    public static RetryPolicy retryingOn(String name, int maxRetries, Duration baseDelay, Duration maxDelay,
                                         Set<FailureKind> retryable) {
        Set<FailureKind> kinds = retryable.isEmpty() ? EnumSet.noneOf(FailureKind.class) : EnumSet.copyOf(retryable);
        return new RetryPolicy(name, maxRetries, baseDelay, maxDelay,
                error -> kinds.contains(FailureClassifier.classify(error)));
    }

    public Duration delayForAttempt(int attempt) {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        int shift = Math.min(attempt, 30);
        long delay = base > (cap >> shift) ? cap : base << shift;
        return Duration.ofMillis(Math.min(delay, cap));
    }

    public boolean retries(Throwable error) {
        return shouldRetry.test(error);
    }
}
