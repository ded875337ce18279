package com.phillippitts.acedaw.service.archive;

import java.util.Objects;

/**
 * An encoded archive ready for download.
 *
 * @param fileName suggested file name, ending in {@value ArchiveFormat#FILE_EXTENSION}
 * @param bytes    archive content
 */
public record ProjectArchive(String fileName, byte[] bytes) {

    public ProjectArchive {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
    }

    @Override
    public String toString() {
        return "ProjectArchive{fileName=" + fileName + ", size=" + bytes.length + "}";
    }
}
