package me.internalizable.platesight.cache;

import java.util.Optional;


public interface CacheService<K, V> {
    Optional<V> get(K key);

    void put(K key, V value);

    /**
     * @return true if an entry was present and removed
     */
    boolean evict(K key);

    void clear();

    boolean containsKey(K key);

    long size();
}
