package com.darksite.metering.adapters;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for TRANSIENT failures.
 *
 * Shared by data calls and credential refresh so both back off the same way.
 * Interruption during a backoff aborts the retry loop and re-asserts the
 * interrupt flag.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Run a call, retrying TRANSIENT failures up to the attempt limit.
     *
     * @param operation name used in log lines
     * @param call      the call to run
     * @return the call's result
     * @throws MeteringException the last failure once retries are spent, or any non-retryable failure
     */
    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            abortIfInterrupted(operation);
            try {
                return call.get();
            } catch (MeteringException e) {
                if (!e.getCategory().isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Attempt {}/{} of {} failed, retrying: {}", attempt, maxAttempts, operation, e.getMessage());
                backoff(attempt);
            }
        }
    }

    /**
     * Sleep before retry number {@code retry} (1-based).
     */
    public void backoff(int retry) {
        long delayMs = backoffMillis(retry);
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MeteringException(ErrorCategory.TRANSIENT, "Interrupted while backing off", e);
        }
    }

    long backoffMillis(int retry) {
        return (long) (initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1)));
    }

    private static void abortIfInterrupted(String operation) {
        if (Thread.currentThread().isInterrupted()) {
            throw new MeteringException(ErrorCategory.TRANSIENT, "Interrupted before " + operation);
        }
    }
}
