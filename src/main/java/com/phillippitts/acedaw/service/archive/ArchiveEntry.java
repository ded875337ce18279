package com.phillippitts.acedaw.service.archive;

import java.util.Arrays;
import java.util.Objects;

/**
 * A payload travelling through an archive together with the key it is stored under.
 *
 * @param key     audio blob key
 * @param payload raw bytes
 */
public record ArchiveEntry(String key, byte[] payload) {

    public ArchiveEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArchiveEntry other)) {
            return false;
        }
        return key.equals(other.key) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ArchiveEntry{key=" + key + ", size=" + payload.length + "}";
    }
}
