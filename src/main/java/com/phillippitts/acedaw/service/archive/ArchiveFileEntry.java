package com.phillippitts.acedaw.service.archive;

import java.util.Objects;

/**
 * One row of the manifest file table: where a payload sits inside the payload region.
 *
 * @param key    audio blob key the payload is restored under
 * @param offset byte offset from the start of the payload region
 * @param size   payload length in bytes
 */
public record ArchiveFileEntry(String key, long offset, long size) {

    public ArchiveFileEntry {
        Objects.requireNonNull(key, "key must not be null");
        if (offset < 0 || size < 0) {
            throw new IllegalArgumentException("offset and size must be non-negative: "
                    + offset + ", " + size);
        }
    }

    /**
     * @return {@code offset + size}, saturated at {@link Long#MAX_VALUE} instead of overflowing
     */
    public long end() {
        try {
            return Math.addExact(offset, size);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
