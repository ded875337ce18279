package com.phillippitts.acedaw.service.audio;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Raw audio payload storage addressed by {@link AudioBlobKey}.
 *
 * <p>Payloads are opaque bytes (normally WAV). Deleting a project record does not delete its
 * audio; callers purge it with {@link #deleteAllForProject(String)}.
 */
public interface AudioBlobStore {

    /**
     * Stores the payload, overwriting any previous one.
     *
     * @return the storage key, for later reference (e.g. an archive file table)
     */
    CompletableFuture<String> save(String projectId, String clipId, AudioVariant variant, byte[] payload);

    /**
     * Stores a payload under a raw key taken from an archive manifest.
     *
     * @throws IllegalArgumentException if the key is not a well-formed audio key
     */
    CompletableFuture<Void> saveByKey(String key, byte[] payload);

    CompletableFuture<Optional<byte[]>> load(String projectId, String clipId, AudioVariant variant);

    CompletableFuture<Optional<byte[]>> loadByKey(String key);

    /**
     * Removes one payload. Idempotent.
     */
    CompletableFuture<Void> delete(String projectId, String clipId, AudioVariant variant);

    /**
     * @return every audio key under the project's prefix, in lexical order
     */
    CompletableFuture<List<String>> listKeys(String projectId);

    /**
     * Deletes every payload of the project. Zero matches is not an error.
     *
     * @return number of keys deleted
     */
    CompletableFuture<Integer> deleteAllForProject(String projectId);
}
