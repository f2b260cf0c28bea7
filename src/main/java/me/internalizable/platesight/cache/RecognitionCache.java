package me.internalizable.platesight.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import me.internalizable.platesight.model.PlateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Recognition results keyed by image hash. Entries live for a fixed TTL from
 * their last write and are still served at exactly {@code writeTime + ttl};
 * when full, the entry written longest ago is evicted (FIFO by write time,
 * reads do not refresh an entry).
 */
@Getter
public class RecognitionCache implements StatisticalCacheService<String, PlateResult> {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private final Cache<String, PlateResult> cache;
    private final String name;
    private final Duration ttl;
    private final int maxEntries;

    @Getter(AccessLevel.NONE)
    private com.github.benmanes.caffeine.cache.stats.CacheStats baseline;

    @Builder
    public RecognitionCache(String name, Integer maxEntries, Duration ttl, Ticker ticker) {
        this.name = name != null ? name : "recognition";
        this.maxEntries = maxEntries != null ? maxEntries : DEFAULT_MAX_ENTRIES;
        if (this.maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive but was " + this.maxEntries);
        }
        this.ttl = ttl != null ? ttl : DEFAULT_TTL;
        if (this.ttl.isNegative() || this.ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive but was " + this.ttl);
        }
        this.cache = Caffeine.newBuilder()
                // Caffeine expires at age >= duration; entries must survive until age > ttl
                .expireAfterWrite(this.ttl.plusNanos(1))
                .ticker(ticker != null ? ticker : Ticker.systemTicker())
                .executor(Runnable::run)
                .recordStats()
                .build();
        this.baseline = cache.stats();
    }

    @Override
    public synchronized Optional<PlateResult> get(String key) {
        PlateResult value = cache.getIfPresent(key);
        if (value != null) {
            logger.debug("[{}] Cache hit for image {}", name, ImageHasher.abbreviate(key));
        }
        return Optional.ofNullable(value);
    }

    @Override
    public synchronized void put(String key, PlateResult value) {
        if (!cache.asMap().containsKey(key) && cache.estimatedSize() >= maxEntries) {
            cache.cleanUp();
            if (cache.estimatedSize() >= maxEntries) {
                evictOldest();
            }
        }
        cache.put(key, value);
        logger.debug("[{}] Cached result for image {}", name, ImageHasher.abbreviate(key));
    }

    private void evictOldest() {
        cache.policy().expireAfterWrite().ifPresent(expiration ->
                expiration.oldest(1).keySet().forEach(oldest -> {
                    cache.invalidate(oldest);
                    logger.debug("[{}] Capacity reached, evicted image {}", name, ImageHasher.abbreviate(oldest));
                }));
    }

    @Override
    public synchronized boolean evict(String key) {
        boolean present = cache.asMap().remove(key) != null;
        if (present) {
            logger.debug("[{}] Evicted image {}", name, ImageHasher.abbreviate(key));
        }
        return present;
    }

    /**
     * Empties the cache and restarts the hit/miss counters.
     */
    @Override
    public synchronized void clear() {
        cache.invalidateAll();
        baseline = cache.stats();
        logger.info("[{}] Cache cleared", name);
    }

    /**
     * Presence check that does not count as a hit or a miss.
     */
    @Override
    public synchronized boolean containsKey(String key) {
        return cache.policy().getIfPresentQuietly(key) != null;
    }

    @Override
    public synchronized long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Drops every expired entry now instead of waiting for reads to find them.
     * @return number of entries removed
     */
    public synchronized int cleanup() {
        long before = cache.estimatedSize();
        cache.cleanUp();
        int removed = (int) Math.max(0, before - cache.estimatedSize());
        if (removed > 0) {
            logger.debug("[{}] Removed {} expired entries", name, removed);
        }
        return removed;
    }

    @Override
    public synchronized CacheStats getStats() {
        var stats = cache.stats().minus(baseline);
        return CacheStats.of(stats.hitCount(), stats.missCount(), size());
    }
}
