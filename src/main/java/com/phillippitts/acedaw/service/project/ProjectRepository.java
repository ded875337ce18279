package com.phillippitts.acedaw.service.project;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.domain.ProjectSummary;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * CRUD over project records plus the library listing.
 */
public interface ProjectRepository {

    /** Key prefix of every project record. */
    String KEY_PREFIX = "project:";

    /**
     * Writes the full record, replacing any previous one with the same id.
     */
    CompletableFuture<Void> save(Project project);

    /**
     * @return the project exactly as last saved, or empty when no record exists
     * @throws com.phillippitts.acedaw.exception.CorruptProjectRecordException (as the future's
     *         failure) when a record exists but cannot be parsed
     */
    CompletableFuture<Optional<Project>> load(String id);

    /**
     * Removes the record. Idempotent. Audio blobs are not touched.
     */
    CompletableFuture<Void> delete(String id);

    /**
     * @return summaries of every readable project, most recently updated first; unreadable
     *         records are left out
     */
    CompletableFuture<List<ProjectSummary>> list();

    static String keyFor(String id) {
        return KEY_PREFIX + id;
    }
}
