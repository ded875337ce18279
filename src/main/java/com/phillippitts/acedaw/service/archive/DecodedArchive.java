package com.phillippitts.acedaw.service.archive;

import com.phillippitts.acedaw.domain.Project;

import java.util.List;
import java.util.Objects;

/**
 * Result of decoding an archive; nothing has been written yet.
 *
 * @param project project snapshot from the manifest
 * @param entries payloads in file-table order
 */
public record DecodedArchive(Project project, List<ArchiveEntry> entries) {

    public DecodedArchive {
        Objects.requireNonNull(project, "project must not be null");
        entries = List.copyOf(entries);
    }
}
