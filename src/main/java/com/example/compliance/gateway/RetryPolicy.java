package com.example.compliance.gateway;

import java.time.Duration;

/**
 * Retry parameters of {@link ResilientTransport}.
 *
 * @param maxAttempts attempts per call, at least 1
 * @param baseDelay   delay before the second attempt, doubled for each further one
 * @param maxJitter   upper bound of the uniform random delay added to every backoff
 * @param timeout     per-attempt connect and read timeout
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxJitter, Duration timeout) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) baseDelay = Duration.ZERO;
        if (maxJitter == null || maxJitter.isNegative()) maxJitter = Duration.ZERO;
    }

    /**
     * Backoff after failed attempt {@code k} (1-indexed): {@code baseDelay * 2^(k-1) + jitter},
     * with {@code jitterFraction} in [0, 1).
     */
    public Duration backoff(int attempt, double jitterFraction) {
        long exponential = baseDelay.toMillis() << Math.min(attempt - 1, 20);
        long jitter = (long) (maxJitter.toMillis() * jitterFraction);
        return Duration.ofMillis(exponential + jitter);
    }
}
