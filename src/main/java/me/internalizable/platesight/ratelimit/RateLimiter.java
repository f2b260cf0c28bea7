package me.internalizable.platesight.ratelimit;

/**
 * Admission control in front of the recognizer: a cap on in-flight requests
 * plus a sliding-window cap on requests started.
 */
public interface RateLimiter {

    /**
     * Check both gates without reserving anything
     * @return true if a request started now would be admitted
     */
    boolean canAccept();

    /**
     * Record a request as started: one more in flight, one more in the window
     */
    void start();

    /**
     * Record a started request as finished. Never drops the in-flight count below zero.
     */
    void end();

    /**
     * Check and start in one step
     * @return true if the request was admitted and must later be matched by {@link #end()}
     */
    boolean tryStart();

    RateLimitStats getStats();

    /**
     * Forget all in-flight and windowed requests (useful for testing or admin overrides)
     */
    void reset();
}
