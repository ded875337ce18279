package com.phillippitts.acedaw.service.archive;

import com.phillippitts.acedaw.config.properties.ArchiveProperties;
import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.exception.ArchiveDecodeException;
import com.phillippitts.acedaw.exception.ArchiveTooLargeException;
import com.phillippitts.acedaw.exception.InvalidManifestException;
import com.phillippitts.acedaw.exception.ProjectNotFoundException;
import com.phillippitts.acedaw.service.audio.AudioBlobKey;
import com.phillippitts.acedaw.service.audio.AudioBlobStore;
import com.phillippitts.acedaw.service.metrics.ArchiveMetrics;
import com.phillippitts.acedaw.service.project.ProjectRepository;
import com.phillippitts.acedaw.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Export and import of whole projects as {@code .acedaw} archives.
 *
 * <p><b>Export</b> loads the project, enumerates every audio key under its prefix, reads the
 * payloads one after another and encodes them with {@link ArchiveCodec}. The archive is built
 * fully in memory.
 *
 * <p><b>Import</b> is all-or-nothing with respect to decoding: the buffer is size-checked,
 * decoded and every key validated before the first write. Only then are the payloads written, one
 * after another in file-table order, followed by the project record.
 */
@Service
public class ProjectArchiveService {

    private static final Logger LOG = LogManager.getLogger(ProjectArchiveService.class);

    private static final Pattern UNSAFE_FILE_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9\\-_ ]");
    private static final String FALLBACK_FILE_NAME = "project";

    private final ProjectRepository projects;
    private final AudioBlobStore blobs;
    private final ArchiveProperties properties;
    private final ArchiveMetrics metrics;

    public ProjectArchiveService(ProjectRepository projects,
                                 AudioBlobStore blobs,
                                 ArchiveProperties properties,
                                 ArchiveMetrics metrics) {
        this.projects = Objects.requireNonNull(projects);
        this.blobs = Objects.requireNonNull(blobs);
        this.properties = Objects.requireNonNull(properties);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Exports a stored project.
     *
     * @return future of the archive; fails with {@link ProjectNotFoundException} when no such project
     */
    public CompletableFuture<ProjectArchive> exportProject(String projectId) {
        Objects.requireNonNull(projectId, "projectId");
        return projects.load(projectId)
                .thenCompose(found -> {
                    Project project = found.orElseThrow(() -> new ProjectNotFoundException(projectId));
                    return exportArchive(project)
                            .thenApply(bytes -> new ProjectArchive(archiveFileName(project), bytes));
                });
    }

    /**
     * Encodes the given project snapshot with every audio blob stored under its id.
     */
    public CompletableFuture<byte[]> exportArchive(Project project) {
        Objects.requireNonNull(project, "project");
        long t0 = System.nanoTime();
        return blobs.listKeys(project.id())
                .thenCompose(this::readSequentially)
                .thenApply(entries -> {
                    byte[] archive = ArchiveCodec.encode(project, entries);
                    long elapsed = System.nanoTime() - t0;
                    metrics.incrementOutcome(ArchiveMetrics.EXPORT, ArchiveMetrics.SUCCESS);
                    metrics.recordSize(ArchiveMetrics.EXPORT, archive.length);
                    metrics.recordLatency(ArchiveMetrics.EXPORT, elapsed);
                    LOG.info("Exported project {} with {} blob(s), {} bytes in {} ms",
                            project.id(), entries.size(), archive.length, elapsed / 1_000_000L);
                    return archive;
                })
                .whenComplete((archive, error) -> {
                    if (error != null) {
                        metrics.incrementOutcome(ArchiveMetrics.EXPORT, failureReason(error));
                    }
                });
    }

    /**
     * Restores an archive into the library, overwriting a project with the same id and any
     * blobs with the same keys.
     *
     * @return future of the restored project; fails with {@link ArchiveTooLargeException} or an
     *         {@link ArchiveDecodeException} subclass, in which case nothing was written
     */
    public CompletableFuture<Project> importArchive(byte[] archive) {
        Objects.requireNonNull(archive, "archive");
        long t0 = System.nanoTime();
        DecodedArchive decoded;
        try {
            if (archive.length > properties.getMaxSizeBytes()) {
                throw new ArchiveTooLargeException(archive.length, properties.getMaxSizeBytes());
            }
            decoded = ArchiveCodec.decode(archive);
            requireOwnKeys(decoded);
        } catch (ArchiveDecodeException | ArchiveTooLargeException e) {
            LOG.warn("Rejected archive of {} bytes: {}", archive.length, e.getMessage());
            metrics.incrementOutcome(ArchiveMetrics.IMPORT, failureReason(e));
            return CompletableFuture.failedFuture(e);
        }

        Project project = decoded.project();
        return writeSequentially(decoded.entries())
                .thenCompose(v -> projects.save(project))
                .thenApply(v -> {
                    long elapsed = System.nanoTime() - t0;
                    metrics.incrementOutcome(ArchiveMetrics.IMPORT, ArchiveMetrics.SUCCESS);
                    metrics.recordSize(ArchiveMetrics.IMPORT, archive.length);
                    metrics.recordLatency(ArchiveMetrics.IMPORT, elapsed);
                    LOG.info("Imported project {} (\"{}\") with {} blob(s) in {} ms", project.id(),
                            LogSanitizer.forLog(project.name()), decoded.entries().size(), elapsed / 1_000_000L);
                    return project;
                })
                .whenComplete((p, error) -> {
                    if (error != null) {
                        metrics.incrementOutcome(ArchiveMetrics.IMPORT, failureReason(error));
                    }
                });
    }

    /**
     * Download name: the project name without characters outside {@code [a-zA-Z0-9\-_ ]},
     * plus {@value ArchiveFormat#FILE_EXTENSION}.
     */
    public static String archiveFileName(Project project) {
        String base = UNSAFE_FILE_NAME_CHARS.matcher(project.name()).replaceAll("").trim();
        if (base.isEmpty()) {
            base = FALLBACK_FILE_NAME;
        }
        return base + ArchiveFormat.FILE_EXTENSION;
    }

    private CompletableFuture<List<ArchiveEntry>> readSequentially(List<String> keys) {
        CompletableFuture<List<ArchiveEntry>> chain = CompletableFuture.completedFuture(new ArrayList<>(keys.size()));
        for (String key : keys) {
            chain = chain.thenCompose(entries -> blobs.loadByKey(key).thenApply(payload -> {
                // A key may vanish between listing and reading; export what is still there.
                payload.ifPresent(bytes -> entries.add(new ArchiveEntry(key, bytes)));
                return entries;
            }));
        }
        return chain;
    }

    private CompletableFuture<Void> writeSequentially(List<ArchiveEntry> entries) {
        // File-table order: a key repeated in the archive ends up holding its last payload.
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ArchiveEntry entry : entries) {
            chain = chain.thenCompose(v -> blobs.saveByKey(entry.key(), entry.payload()));
        }
        return chain;
    }

    private static void requireOwnKeys(DecodedArchive decoded) {
        String projectId = decoded.project().id();
        for (ArchiveEntry entry : decoded.entries()) {
            Optional<AudioBlobKey> key = AudioBlobKey.parse(entry.key());
            if (key.isEmpty() || !key.get().projectId().equals(projectId)) {
                throw new InvalidManifestException("File entry '" + LogSanitizer.forLog(entry.key())
                        + "' is not an audio key of project " + LogSanitizer.forLog(projectId));
            }
        }
    }

    private static String failureReason(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        return cause.getClass().getSimpleName();
    }
}
