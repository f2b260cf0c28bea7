package me.internalizable.platesight.cache;

public record CacheStats(long hits, long misses, long size, double hitRate) {

    public static CacheStats of(long hits, long misses, long size) {
        long requests = hits + misses;
        return new CacheStats(hits, misses, size, requests == 0 ? 0.0 : (double) hits / requests);
    }
}
