package com.phillippitts.acedaw.config;

import com.phillippitts.acedaw.config.properties.StorageProperties;
import com.phillippitts.acedaw.storage.FileKeyValueStore;
import com.phillippitts.acedaw.storage.InMemoryKeyValueStore;
import com.phillippitts.acedaw.storage.KeyValueStore;
import com.phillippitts.acedaw.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StorageConfigTest {

    @TempDir
    Path dir;

    private final StorageConfig config = new StorageConfig();

    @Test
    void defaultsToFileStorageUnderUserHome() {
        StorageProperties properties = new StorageProperties();

        assertThat(properties.getType()).isEqualTo(StorageProperties.StorageType.FILE);
        assertThat(properties.directoryPath()).endsWithRaw(Path.of(".acedaw", "store"));
    }

    @Test
    void fileTypeCreatesStoreInConfiguredDirectory() {
        StorageProperties properties = new StorageProperties();
        properties.setDirectory(dir.resolve("lib").toString());

        KeyValueStore store = config.keyValueStore(properties, new SyncExecutor());

        assertThat(store).isInstanceOf(FileKeyValueStore.class);
        assertThat(((FileKeyValueStore) store).getDirectory()).isEqualTo(dir.resolve("lib").toAbsolutePath());
    }

    @Test
    void memoryTypeCreatesHeapStore() {
        StorageProperties properties = new StorageProperties();
        properties.setType(StorageProperties.StorageType.MEMORY);

        assertThat(config.keyValueStore(properties, new SyncExecutor())).isInstanceOf(InMemoryKeyValueStore.class);
    }
}
