package com.phillippitts.acedaw.config;

import com.phillippitts.acedaw.config.properties.StorageProperties;
import com.phillippitts.acedaw.storage.FileKeyValueStore;
import com.phillippitts.acedaw.storage.InMemoryKeyValueStore;
import com.phillippitts.acedaw.storage.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the key-value substrate selected by {@code acedaw.storage.type} and the clock used for
 * project timestamps.
 */
@Configuration
public class StorageConfig {

    private static final Logger LOG = LogManager.getLogger(StorageConfig.class);

    @Bean
    public KeyValueStore keyValueStore(StorageProperties properties,
                                       @Qualifier("storageExecutor") Executor storageExecutor) {
        switch (properties.getType()) {
            case MEMORY:
                LOG.warn("Using in-memory storage; projects and audio are lost on shutdown");
                return new InMemoryKeyValueStore();
            case FILE:
            default:
                Path dir = properties.directoryPath().toAbsolutePath();
                LOG.info("Using file storage at {}", dir);
                return new FileKeyValueStore(dir, storageExecutor);
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
