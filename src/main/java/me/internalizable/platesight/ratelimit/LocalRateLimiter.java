package me.internalizable.platesight.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;

/**
 * In-process limiter. Start times are kept as a log and pruned lazily on every
 * check, so nothing runs in the background.
 *
 * Thread-safety: synchronized for concurrent access.
 */
public class LocalRateLimiter implements RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(LocalRateLimiter.class);

    private final Clock clock;
    private final RateLimitSettings settings;
    private final long windowMs;

    private final ArrayDeque<Long> requestTimestamps = new ArrayDeque<>();
    private int currentConcurrent;

    public LocalRateLimiter(Clock clock, RateLimitSettings settings) {
        this.clock = clock;
        this.settings = settings != null ? settings : RateLimitSettings.defaults();
        this.windowMs = this.settings.window().toMillis();
    }

    public RateLimitSettings getSettings() {
        return settings;
    }

    @Override
    public synchronized boolean canAccept() {
        prune(clock.millis());

        if (currentConcurrent >= settings.maxConcurrent()) {
            logger.warn("Rate limit: concurrency cap reached ({}/{})", currentConcurrent, settings.maxConcurrent());
            return false;
        }
        if (requestTimestamps.size() >= settings.maxRequests()) {
            logger.warn("Rate limit: {} requests in the last {} ms (max {})",
                    requestTimestamps.size(), windowMs, settings.maxRequests());
            return false;
        }
        return true;
    }

    @Override
    public synchronized void start() {
        currentConcurrent++;
        requestTimestamps.addLast(clock.millis());
    }

    @Override
    public synchronized void end() {
        if (currentConcurrent > 0) {
            currentConcurrent--;
        } else {
            logger.debug("end() called with no request in flight");
        }
    }

    @Override
    public synchronized boolean tryStart() {
        if (!canAccept()) {
            return false;
        }
        start();
        return true;
    }

    @Override
    public synchronized RateLimitStats getStats() {
        prune(clock.millis());
        return new RateLimitStats(currentConcurrent, requestTimestamps.size(),
                settings.maxConcurrent(), settings.maxRequests(), windowMs);
    }

    public synchronized int getCurrentConcurrent() {
        return currentConcurrent;
    }

    @Override
    public synchronized void reset() {
        currentConcurrent = 0;
        requestTimestamps.clear();
        logger.info("Rate limiter reset");
    }

    private void prune(long now) {
        long cutoff = now - windowMs;
        while (!requestTimestamps.isEmpty() && requestTimestamps.peekFirst() <= cutoff) {
            requestTimestamps.removeFirst();
        }
    }
}
