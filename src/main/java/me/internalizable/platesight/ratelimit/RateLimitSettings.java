package me.internalizable.platesight.ratelimit;

import java.time.Duration;

public record RateLimitSettings(int maxConcurrent, Duration window, int maxRequests) {

    public static final int DEFAULT_MAX_CONCURRENT = 100;
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);
    public static final int DEFAULT_MAX_REQUESTS = 100;

    public RateLimitSettings {
        if (maxConcurrent <= 0) throw new IllegalArgumentException("maxConcurrent <= 0");
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests <= 0");
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static RateLimitSettings defaults() {
        return new RateLimitSettings(DEFAULT_MAX_CONCURRENT, DEFAULT_WINDOW, DEFAULT_MAX_REQUESTS);
    }
}
