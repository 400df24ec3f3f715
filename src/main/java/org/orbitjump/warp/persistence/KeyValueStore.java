package org.orbitjump.warp.persistence;

import java.util.Optional;

/**
 * Generic string key-value persistence collaborator (save file, browser storage, cloud slot).
 */
public interface KeyValueStore {

    /**
     * Returns the value stored under {@code key}, if any.
     */
    Optional<String> get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     */
    void put(String key, String value);
}
