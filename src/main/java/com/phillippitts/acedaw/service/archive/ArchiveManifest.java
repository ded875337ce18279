package com.phillippitts.acedaw.service.archive;

import com.phillippitts.acedaw.domain.Project;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The structured section of an archive.
 *
 * <p>For manifests built by {@link #of(Project, List)}: entries are in offset order, the first
 * offset is 0 and each following offset is the previous offset plus size.
 *
 * @param version format version, see {@link ArchiveFormat#VERSION}
 * @param project project snapshot
 * @param files   file table
 */
public record ArchiveManifest(int version, Project project, List<ArchiveFileEntry> files) {

    public ArchiveManifest {
        Objects.requireNonNull(project, "project must not be null");
        files = List.copyOf(files);
    }

    /**
     * Builds a current-version manifest, laying the payloads out back to back in the given order.
     */
    public static ArchiveManifest of(Project project, List<ArchiveEntry> entries) {
        long offset = 0;
        List<ArchiveFileEntry> table = new ArrayList<>(entries.size());
        for (ArchiveEntry entry : entries) {
            table.add(new ArchiveFileEntry(entry.key(), offset, entry.payload().length));
            offset += entry.payload().length;
        }
        return new ArchiveManifest(ArchiveFormat.VERSION, project, table);
    }

    /**
     * @return total bytes the file table covers
     */
    public long payloadSize() {
        return files.stream().mapToLong(ArchiveFileEntry::size).sum();
    }
}
