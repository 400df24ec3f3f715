package org.orbitjump.warp.persistence;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.util.Objects;
import java.util.Optional;

/**
 * Process-local store for tests and headless runs.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {
    private final Object2ObjectOpenHashMap<String, String> values = new Object2ObjectOpenHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public void put(String key, String value) {
        values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }
}
