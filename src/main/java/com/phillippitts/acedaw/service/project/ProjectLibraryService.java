package com.phillippitts.acedaw.service.project;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.domain.ProjectSummary;
import com.phillippitts.acedaw.exception.ProjectNotFoundException;
import com.phillippitts.acedaw.service.audio.AudioBlobStore;
import com.phillippitts.acedaw.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Project lifecycle on top of {@link ProjectRepository} and {@link AudioBlobStore}.
 *
 * <p>Owns the timestamps: {@link #create(String)} sets both to now, {@link #save(Project)}
 * refreshes {@code updatedAt}. The repository itself stores projects exactly as given, which
 * is what archive import relies on to keep the original times.
 */
@Service
public class ProjectLibraryService {

    private static final Logger LOG = LogManager.getLogger(ProjectLibraryService.class);

    private final ProjectRepository repository;
    private final AudioBlobStore blobs;
    private final Clock clock;

    public ProjectLibraryService(ProjectRepository repository, AudioBlobStore blobs, Clock clock) {
        this.repository = Objects.requireNonNull(repository);
        this.blobs = Objects.requireNonNull(blobs);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Creates and stores an empty project with a fresh random id.
     */
    public CompletableFuture<Project> create(String name) {
        Project project = Project.create(UUID.randomUUID().toString(), name, clock.millis());
        return repository.save(project).thenApply(v -> {
            LOG.info("Created project {} (\"{}\")", project.id(), LogSanitizer.forLog(project.name()));
            return project;
        });
    }

    /**
     * Stores the project with {@code updatedAt} set to now.
     *
     * @return the project as stored
     */
    public CompletableFuture<Project> save(Project project) {
        Objects.requireNonNull(project, "project");
        // A clock behind createdAt (imported project, skewed host) must not break the invariant.
        long now = Math.max(clock.millis(), project.createdAt());
        Project stamped = project.withUpdatedAt(now);
        return repository.save(stamped).thenApply(v -> {
            LOG.info("Saved project {} with {} track(s)", stamped.id(), stamped.tracks().size());
            return stamped;
        });
    }

    /**
     * @return future of the project; fails with {@link ProjectNotFoundException} when absent
     */
    public CompletableFuture<Project> open(String id) {
        return repository.load(id)
                .thenApply(found -> found.orElseThrow(() -> new ProjectNotFoundException(id)));
    }

    public CompletableFuture<List<ProjectSummary>> list() {
        return repository.list();
    }

    /**
     * Deletes the project record, then every audio blob stored under its id.
     *
     * @return number of audio blobs removed
     */
    public CompletableFuture<Integer> deleteWithAudio(String id) {
        Objects.requireNonNull(id, "id");
        return repository.delete(id)
                .thenCompose(v -> blobs.deleteAllForProject(id))
                .thenApply(count -> {
                    LOG.info("Deleted project {} and {} audio blob(s)", id, count);
                    return count;
                });
    }
}
