package com.phillippitts.acedaw.service.project;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.domain.ProjectSummary;
import com.phillippitts.acedaw.exception.CorruptProjectRecordException;
import com.phillippitts.acedaw.storage.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Repository;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * {@link ProjectRepository} storing each project as UTF-8 JSON under {@code project:<id>}.
 *
 * <p><b>Unreadable records:</b> {@link #list()} skips a record that fails to parse and logs a
 * warning, so one damaged entry does not hide the rest of the library. {@link #load(String)} of
 * the same record fails with {@link CorruptProjectRecordException}. Both paths use the same
 * parser, so a record is either readable everywhere or nowhere.
 */
@Repository
public class KeyValueProjectRepository implements ProjectRepository {

    private static final Logger LOG = LogManager.getLogger(KeyValueProjectRepository.class);

    private final KeyValueStore store;

    public KeyValueProjectRepository(KeyValueStore store) {
        this.store = Objects.requireNonNull(store);
    }

    @Override
    public CompletableFuture<Void> save(Project project) {
        Objects.requireNonNull(project, "project");
        byte[] record = ProjectJsonMapper.toJson(project).toString().getBytes(StandardCharsets.UTF_8);
        return store.set(ProjectRepository.keyFor(project.id()), record)
                .thenRun(() -> LOG.debug("Saved project {} ({} tracks, {} bytes)",
                        project.id(), project.tracks().size(), record.length));
    }

    @Override
    public CompletableFuture<Optional<Project>> load(String id) {
        Objects.requireNonNull(id, "id");
        String key = ProjectRepository.keyFor(id);
        return store.get(key).thenApply(data -> data.map(bytes -> parse(key, bytes)));
    }

    @Override
    public CompletableFuture<Void> delete(String id) {
        Objects.requireNonNull(id, "id");
        return store.delete(ProjectRepository.keyFor(id));
    }

    @Override
    public CompletableFuture<List<ProjectSummary>> list() {
        return store.listKeys().thenCompose(keys -> {
            List<CompletableFuture<Optional<ProjectSummary>>> loads = keys.stream()
                    .filter(k -> k.startsWith(KEY_PREFIX))
                    .sorted()
                    .map(this::summarize)
                    .collect(Collectors.toList());
            return CompletableFuture.allOf(loads.toArray(CompletableFuture[]::new))
                    .thenApply(v -> loads.stream()
                            .map(CompletableFuture::join)
                            .flatMap(Optional::stream)
                            .sorted(ProjectSummary.MOST_RECENT_FIRST)
                            .collect(Collectors.toList()));
        });
    }

    private CompletableFuture<Optional<ProjectSummary>> summarize(String key) {
        return store.get(key).thenApply(data -> data.flatMap(bytes -> {
            try {
                return Optional.of(ProjectSummary.of(parse(key, bytes)));
            } catch (CorruptProjectRecordException e) {
                LOG.warn("Skipping unreadable project record {}: {}", key,
                        e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                return Optional.empty();
            }
        }));
    }

    private static Project parse(String key, byte[] bytes) {
        try {
            return ProjectJsonMapper.fromJson(new JSONObject(new String(bytes, StandardCharsets.UTF_8)));
        } catch (JSONException | IllegalArgumentException e) {
            throw new CorruptProjectRecordException(key, e);
        }
    }
}
