package com.phillippitts.acedaw.storage;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link KeyValueStore}. Futures complete on the calling thread.
 *
 * <p>Values are copied on the way in and out so callers cannot mutate stored bytes.
 * Selected with {@code acedaw.storage.type=memory}; also the substrate used by unit tests.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Optional<byte[]>> get(String key) {
        Objects.requireNonNull(key, "key");
        byte[] value = entries.get(key);
        return CompletableFuture.completedFuture(Optional.ofNullable(value).map(byte[]::clone));
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, value.clone());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        Objects.requireNonNull(key, "key");
        entries.remove(key);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Set<String>> listKeys() {
        return CompletableFuture.completedFuture(Set.copyOf(entries.keySet()));
    }

    public int size() {
        return entries.size();
    }
}
