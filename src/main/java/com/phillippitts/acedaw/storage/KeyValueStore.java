package com.phillippitts.acedaw.storage;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Persistent key-value substrate the project library and blob store are built on.
 *
 * <p>Contract: once {@link #set} completes, {@link #get} returns the written bytes until the key
 * is deleted. Writes to the same key are last-write-wins; operations on disjoint keys may run
 * concurrently in any order. Failures complete the returned future exceptionally with a
 * {@link com.phillippitts.acedaw.exception.StorageException}.
 */
public interface KeyValueStore {

    /**
     * @return the stored bytes, or empty when the key is absent
     */
    CompletableFuture<Optional<byte[]>> get(String key);

    /**
     * Creates or overwrites the value at {@code key}.
     */
    CompletableFuture<Void> set(String key, byte[] value);

    /**
     * Removes the key. Deleting an absent key is a no-op.
     */
    CompletableFuture<Void> delete(String key);

    /**
     * @return a snapshot of all keys currently stored
     */
    CompletableFuture<Set<String>> listKeys();
}
