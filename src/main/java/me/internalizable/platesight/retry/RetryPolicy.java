package me.internalizable.platesight.retry;

import java.time.Duration;

public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double backoffMultiplier) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(1000);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(5000);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries < 0");
        if (initialDelay == null || initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay < 0");
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least initialDelay");
        }
        if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier < 1");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_BACKOFF_MULTIPLIER);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Wait before retry number {@code retry} (1-based): the initial delay grown
     * by the multiplier per earlier retry, capped at the maximum delay.
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) throw new IllegalArgumentException("retry < 1");
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, retry - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }
}
