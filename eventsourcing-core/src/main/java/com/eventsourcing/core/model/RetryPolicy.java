package com.eventsourcing.core.model;

import com.eventsourcing.core.exception.EventSourcingException;
import com.eventsourcing.core.exception.WrongExpectedRevisionException;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry for the read-decide-append cycle.
 * Immutable and shareable between command handlers.
 *
 * Only errors whose code is listed in retryableErrors are retried; by default
 * that is the optimistic-concurrency conflict. Business rule violations are
 * terminal for a command and must never be listed here.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> retryableErrors
) {
    public static final Set<String> CONCURRENCY_CONFLICTS = Set.of(WrongExpectedRevisionException.ERROR_CODE);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0], got " + jitterFactor);
        }
        retryableErrors = retryableErrors == null ? Set.of() : Set.copyOf(retryableErrors);
    }

    /**
     * Default policy: 5 attempts, exponential backoff starting at 10ms.
     */
    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }

    /**
     * Single attempt: conflicts surface to the caller immediately.
     */
    public static RetryPolicy noRetry() {
        return builder()
            .maxAttempts(1)
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .jitterFactor(0.0)
            .build();
    }

    /**
     * Retry conflicts right away without sleeping. Useful in tests.
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return builder()
            .maxAttempts(maxAttempts)
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .jitterFactor(0.0)
            .build();
    }

    /**
     * Compute the pause before the attempt following the given one.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     * @return Duration to wait before re-reading the stream
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        double baseBackoffMs = initialBackoff.toMillis() *
            Math.pow(backoffMultiplier, attemptNumber - 1);

        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        // backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange +
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if the given failure should trigger a re-read and retry.
     */
    public boolean shouldRetry(EventSourcingException failure) {
        return failure != null && retryableErrors.contains(failure.getErrorCode());
    }

    /**
     * Check if more attempts are available.
     *
     * @param currentAttempt Current attempt number (1-indexed)
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(10);
        private Duration maxBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.2;
        private Set<String> retryableErrors = CONCURRENCY_CONFLICTS;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryableErrors(Set<String> retryableErrors) {
            this.retryableErrors = retryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maxAttempts, initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor, retryableErrors
            );
        }
    }
}
