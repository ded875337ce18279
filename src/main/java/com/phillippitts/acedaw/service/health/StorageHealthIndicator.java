package com.phillippitts.acedaw.service.health;

import com.phillippitts.acedaw.storage.FileKeyValueStore;
import com.phillippitts.acedaw.storage.KeyValueStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for the key-value substrate.
 *
 * <p>File storage is UP when its directory exists and is writable; in-memory storage is always
 * UP. Exposed via /actuator/health endpoint.
 */
@Component
public class StorageHealthIndicator implements HealthIndicator {

    private final KeyValueStore store;

    public StorageHealthIndicator(KeyValueStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        if (!(store instanceof FileKeyValueStore fileStore)) {
            return Health.up()
                    .withDetail("type", "memory")
                    .withDetail("status", "Heap storage, not persisted")
                    .build();
        }

        Path dir = fileStore.getDirectory();
        boolean exists = Files.isDirectory(dir);
        boolean writable = exists && Files.isWritable(dir);
        Health.Builder builder = writable ? Health.up() : Health.down();
        return builder
                .withDetail("type", "file")
                .withDetail("directory", formatStatus(exists, writable, dir))
                .build();
    }

    private String formatStatus(boolean exists, boolean writable, Path path) {
        if (!exists) {
            return "NOT FOUND at " + path;
        }
        if (!writable) {
            return "not writable at " + path;
        }
        return "writable at " + path;
    }
}
