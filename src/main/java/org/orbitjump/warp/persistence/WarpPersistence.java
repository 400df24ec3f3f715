package org.orbitjump.warp.persistence;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Saves and loads the warp drive under one key of a {@link KeyValueStore}.
 *
 * <p>The last document read or written is retained so that fields written by other versions of
 * the game are carried over on the next save.</p>
 */
@Slf4j
public final class WarpPersistence {

    public static final String STORAGE_KEY = "warpDrive";

    private final KeyValueStore store;
    private final WarpStateCodec codec;
    private JsonObject lastDocument;

    public WarpPersistence(KeyValueStore store) {
        this(store, new WarpStateCodec());
    }

    public WarpPersistence(KeyValueStore store, WarpStateCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Writes {@code state} to the store.
     */
    public void save(WarpSaveState state) {
        Objects.requireNonNull(state, "state");
        JsonObject document = codec.toJson(state, lastDocument);
        store.put(STORAGE_KEY, codec.write(document));
        lastDocument = document;
    }

    /**
     * Returns whether anything is stored under {@link #STORAGE_KEY}, decodable or not.
     */
    public boolean hasStoredState() {
        return store.get(STORAGE_KEY).filter(raw -> !raw.isBlank()).isPresent();
    }

    /**
     * Reads the stored state.
     *
     * @return the decoded state; empty when nothing is stored or the stored text is not a JSON
     *     object (a fresh state should be used).
     */
    public Optional<WarpSaveState> load() {
        Optional<String> raw = store.get(STORAGE_KEY);
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }
        try {
            JsonObject document = codec.parse(raw.get());
            WarpSaveState state = codec.fromJson(document);
            lastDocument = document;
            return Optional.of(state);
        } catch (JsonParseException ex) {
            log.warn("discarding corrupt warp save: {}", ex.getMessage());
            lastDocument = null;
            return Optional.empty();
        }
    }
}
