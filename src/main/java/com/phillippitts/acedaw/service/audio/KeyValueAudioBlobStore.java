package com.phillippitts.acedaw.service.audio;

import com.phillippitts.acedaw.storage.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * {@link AudioBlobStore} on top of the shared {@link KeyValueStore}.
 */
@Service
public class KeyValueAudioBlobStore implements AudioBlobStore {

    private static final Logger LOG = LogManager.getLogger(KeyValueAudioBlobStore.class);

    private final KeyValueStore store;

    public KeyValueAudioBlobStore(KeyValueStore store) {
        this.store = Objects.requireNonNull(store);
    }

    @Override
    public CompletableFuture<String> save(String projectId, String clipId, AudioVariant variant, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        String key = new AudioBlobKey(projectId, clipId, variant).toKey();
        return store.set(key, payload).thenApply(v -> {
            LOG.debug("Stored {} bytes at {}", payload.length, key);
            return key;
        });
    }

    @Override
    public CompletableFuture<Void> saveByKey(String key, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (AudioBlobKey.parse(key).isEmpty()) {
            throw new IllegalArgumentException("Not an audio key: " + key);
        }
        return store.set(key, payload);
    }

    @Override
    public CompletableFuture<Optional<byte[]>> load(String projectId, String clipId, AudioVariant variant) {
        return store.get(new AudioBlobKey(projectId, clipId, variant).toKey());
    }

    @Override
    public CompletableFuture<Optional<byte[]>> loadByKey(String key) {
        return store.get(Objects.requireNonNull(key, "key"));
    }

    @Override
    public CompletableFuture<Void> delete(String projectId, String clipId, AudioVariant variant) {
        return store.delete(new AudioBlobKey(projectId, clipId, variant).toKey());
    }

    @Override
    public CompletableFuture<List<String>> listKeys(String projectId) {
        String prefix = AudioBlobKey.projectPrefix(projectId);
        return store.listKeys().thenApply(keys -> keys.stream()
                .filter(k -> k.startsWith(prefix))
                .sorted()
                .collect(Collectors.toList()));
    }

    @Override
    public CompletableFuture<Integer> deleteAllForProject(String projectId) {
        return listKeys(projectId).thenCompose(keys -> {
            // Keys are disjoint, so the deletes may run in any order.
            CompletableFuture<?>[] deletes = keys.stream()
                    .map(store::delete)
                    .toArray(CompletableFuture[]::new);
            return CompletableFuture.allOf(deletes).thenApply(v -> {
                LOG.info("Deleted {} audio blob(s) of project {}", keys.size(), projectId);
                return keys.size();
            });
        });
    }
}
