package me.internalizable.platesight.ratelimit;

public record RateLimitStats(
        int currentConcurrent,
        int requestsInWindow,
        int maxConcurrent,
        int maxRequests,
        long windowMs
) {
}
