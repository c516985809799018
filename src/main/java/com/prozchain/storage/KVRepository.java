package com.prozchain.storage;

import java.util.List;
import java.util.Optional;

public interface KVRepository<K, V> {

    /**
     * Saves a value under the given key, replacing any existing value.
     *
     * @return whether the value was saved
     */
    boolean save(K key, V value);

    Optional<V> find(K key);

    @SuppressWarnings("unchecked")
    default <T> T find(K key, T defaultValue) {
        return (T) find(key).orElse((V) defaultValue);
    }

    boolean delete(K key);

    List<K> findKeysByPrefix(String prefix, int limit);
}
