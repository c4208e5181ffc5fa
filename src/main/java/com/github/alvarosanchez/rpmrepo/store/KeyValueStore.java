package com.github.alvarosanchez.rpmrepo.store;

import java.util.Optional;

/**
 * Durable mapping from string keys to byte values. No transactions and no secondary indexes.
 *
 * <p>Implementations signal read and write failures with
 * {@link com.github.alvarosanchez.rpmrepo.exception.StorageUnavailableException}.
 */
public interface KeyValueStore {

    /**
     * Reads a value.
     *
     * @param key entry key
     * @return stored bytes, or empty when the key is absent
     */
    Optional<byte[]> get(String key);

    /**
     * Writes a value, replacing any previous one.
     *
     * @param key entry key
     * @param value bytes to store
     */
    void put(String key, byte[] value);

    /**
     * Removes a value. Removing an absent key is a no-op.
     *
     * @param key entry key
     */
    void delete(String key);
}
