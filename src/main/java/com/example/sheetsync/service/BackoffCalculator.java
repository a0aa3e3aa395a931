package com.example.sheetsync.service;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with additive jitter. The n-th retry waits
 * {@code min(maxDelay, initialDelay * multiplier^(n-1))} moved by up to half the
 * initial delay either way, then clamped to {@code [0, maxDelay]}.
 */
public class BackoffCalculator {

    private final RetryPolicy policy;
    private final DoubleSupplier random;

    public BackoffCalculator(RetryPolicy policy, DoubleSupplier random) {
        this.policy = policy;
        this.random = random;
    }

    /**
     * @param retryNumber 1 for the wait after the first failed attempt
     * @param retryAfterSeconds server hint, replaces the exponential base when present
     */
    public Duration delayBeforeRetry(int retryNumber, Long retryAfterSeconds) {
        long cap = policy.getMaxDelay().toMillis();
        long initial = policy.getInitialDelay().toMillis();

        double base;
        if (retryAfterSeconds != null && retryAfterSeconds > 0) {
            base = retryAfterSeconds * 1000d;
        } else {
            base = initial * Math.pow(policy.getBackoffMultiplier(), Math.max(0, retryNumber - 1));
        }
        base = Math.min(base, cap);

        if (policy.isJitter()) {
            base += (random.getAsDouble() - 0.5) * initial;
        }
        long millis = Math.round(Math.max(0, Math.min(base, cap)));
        return Duration.ofMillis(millis);
    }
}
