package me.internalizable.platesight.cache;


public interface StatisticalCacheService<K, V> extends CacheService<K, V> {

    /**
     * Get hit/miss counters and current size, counted since the last clear
     * @return Snapshot of the cache statistics
     */
    CacheStats getStats();

    /**
     * Get the cache hit rate
     * @return Hit rate as a ratio (0-1), 0 when nothing was requested yet
     */
    default double getHitRate() {
        return getStats().hitRate();
    }
}
