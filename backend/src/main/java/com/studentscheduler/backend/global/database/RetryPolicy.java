package com.studentscheduler.backend.global.database;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff: the wait before retry {@code n} (1-based) is
 * {@code min(initialDelay * multiplier^(n-1), maxDelay)}.
 *
 * <p>Immutable; build with {@link #builder()} or one of the factories.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelay = builder.initialDelay;
        this.multiplier = builder.multiplier;
        this.maxDelay = builder.maxDelay;
    }

    /**
     * Five attempts, 2s initial delay doubling up to 30s.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static RetryPolicy exponentialBackoff(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return builder()
                .maxAttempts(maxAttempts)
                .initialDelay(initialDelay)
                .multiplier(2.0)
                .maxDelay(maxDelay)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the wait before the given retry.
     *
     * @param retryNumber 1 for the wait after the first failed attempt
     */
    public Duration delayBeforeRetry(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("retryNumber must be >= 1");
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retryNumber - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * @param attemptsMade attempts already executed, including the one that just failed
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
                + ", initialDelay=" + initialDelay
                + ", multiplier=" + multiplier
                + ", maxDelay=" + maxDelay + '}';
    }

    public static final class Builder {

        private int maxAttempts = 5;
        private Duration initialDelay = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(30);

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            Objects.requireNonNull(initialDelay, "initialDelay");
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must not be negative");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public RetryPolicy build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= initialDelay");
            }
            return new RetryPolicy(this);
        }
    }
}
