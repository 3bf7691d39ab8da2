package com.abba.agenda.infrastructure.retry;

import com.abba.agenda.application.dto.NonFatalError;
import com.abba.agenda.application.dto.StepOutcome;
import com.abba.agenda.domain.exception.CollaboratorException;
import com.abba.agenda.domain.exception.FailureKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

@Component
@Slf4j
@RequiredArgsConstructor
public class RetryExecutor {

    private final Sleeper sleeper;

    /**
     * Runs {@code action}, retrying while the policy accepts the failure and attempts remain.
     * The last failure is rethrown unchanged.
     */
    public <T> T withRetry(RetryPolicy policy, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (attempt >= policy.maxRetries() || !policy.retries(e)) {
                    throw e;
                }
                Duration delay = policy.delayForAttempt(attempt);
                attempt++;
                log.debug("Retrying policy={} attempt={}/{} delayMs={} error={}",
                        policy.name(), attempt, policy.maxRetries(), delay.toMillis(), e.getMessage());
                pause(delay);
            }
        }
    }

    public void run(RetryPolicy policy, Runnable action) {
        withRetry(policy, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Best-effort variant: failures after retries are returned as a {@link NonFatalError} and logged.
     */
    public <T> StepOutcome<T> attempt(String step, RetryPolicy policy, Supplier<T> action) {
        try {
            return StepOutcome.success(withRetry(policy, action));
        } catch (RuntimeException e) {
            NonFatalError error = NonFatalError.from(step, e);
            log.warn("Best-effort step failed step={} kind={} error={}", step, error.kind(), e.getMessage());
            return StepOutcome.failure(error);
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(FailureKind.UNKNOWN, "Interrupted while waiting to retry", e);
        }
    }
}
