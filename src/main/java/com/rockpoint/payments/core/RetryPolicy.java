package com.rockpoint.payments.core;

import lombok.Value;

import java.time.Duration;

/**
 * Attempt bound and backoff curve for one gateway call. The delay before the
 * n-th retry is {@code min(baseDelay * 2^(n-1), capDelay)}.
 */
@Value
public class RetryPolicy {

    int maxAttempts;
    Duration baseDelay;
    Duration capDelay;

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, Duration capDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (baseDelay.isNegative() || capDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Invalid backoff: base=" + baseDelay + " cap=" + capDelay);
        }
        return new RetryPolicy(maxAttempts, baseDelay, capDelay);
    }

    /**
     * @param failedAttempts attempts that failed so far, at least 1
     */
    public Duration delayAfter(int failedAttempts) {
        int exponent = Math.min(Math.max(failedAttempts - 1, 0), 30);
        long delayMs = baseDelay.toMillis() * (1L << exponent);
        if (delayMs < 0 || delayMs > capDelay.toMillis()) {
            return capDelay;
        }
        return Duration.ofMillis(delayMs);
    }
}
