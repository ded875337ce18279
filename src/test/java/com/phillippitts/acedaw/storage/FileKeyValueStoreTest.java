package com.phillippitts.acedaw.storage;

import com.phillippitts.acedaw.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FileKeyValueStoreTest {

    @TempDir
    Path dir;

    private FileKeyValueStore store;

    @BeforeEach
    void setUp() {
        store = new FileKeyValueStore(dir.resolve("store"), new SyncExecutor());
    }

    @Test
    void createsDirectoryOnConstruction() {
        assertThat(Files.isDirectory(dir.resolve("store"))).isTrue();
        assertThat(store.getDirectory()).isEqualTo(dir.resolve("store"));
    }

    @Test
    void roundTripsValuesForKeysWithDelimitersAndUnicode() {
        String key = "audio:proj-1:clip/2:cumulative é";
        byte[] value = {0, 1, 2, (byte) 0xFF};

        store.set(key, value).join();

        assertThat(store.get(key).join()).hasValueSatisfying(v -> assertThat(v).containsExactly(value));
        assertThat(store.listKeys().join()).containsExactly(key);
    }

    @Test
    void missingKeyReadsAsEmpty() {
        assertThat(store.get("project:none").join()).isEmpty();
    }

    @Test
    void overwriteReplacesContentAndLeavesNoTempFiles() throws IOException {
        store.set("k", new byte[]{1, 2, 3, 4}).join();
        store.set("k", new byte[]{5}).join();

        assertThat(store.get("k").join()).hasValueSatisfying(v -> assertThat(v).containsExactly(5));
        try (Stream<Path> files = Files.list(store.getDirectory())) {
            assertThat(files).hasSize(1).allSatisfy(f -> assertThat(f.toString()).endsWith(".bin"));
        }
    }

    @Test
    void deleteIsIdempotent() {
        store.set("k", new byte[]{1}).join();

        store.delete("k").join();
        store.delete("k").join();

        assertThat(store.get("k").join()).isEmpty();
        assertThat(store.listKeys().join()).isEmpty();
    }

    @Test
    void listKeysIgnoresForeignFiles() throws IOException {
        store.set("project:p1", new byte[]{1}).join();
        Files.writeString(store.getDirectory().resolve("README.txt"), "not a value");
        Files.writeString(store.getDirectory().resolve("!!!.bin"), "bad name");

        assertThat(store.listKeys().join()).containsExactly("project:p1");
    }

    @Test
    void dataSurvivesReopening() {
        store.set("project:p1", new byte[]{7}).join();

        FileKeyValueStore reopened = new FileKeyValueStore(store.getDirectory(), new SyncExecutor());

        assertThat(reopened.get("project:p1").join()).hasValueSatisfying(v -> assertThat(v).containsExactly(7));
    }

    @Test
    void fileNamesAreFilesystemSafe() {
        Path file = store.fileFor("audio:a/b\\c:d:isolated");

        assertThat(file.getParent()).isEqualTo(store.getDirectory());
        assertThat(file.getFileName().toString()).matches("[A-Za-z0-9_-]+\\.bin");
    }

    @Test
    void concurrentWritesToOneKeyAllSucceedAndLeaveOneWholeValue() throws IOException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            FileKeyValueStore concurrent = new FileKeyValueStore(dir.resolve("concurrent"), pool);
            for (int round = 0; round < 20; round++) {
                List<CompletableFuture<Void>> writes = new ArrayList<>();
                for (int writer = 0; writer < 8; writer++) {
                    byte[] value = new byte[64 * 1024];
                    Arrays.fill(value, (byte) writer);
                    writes.add(concurrent.set("project:p1", value));
                }
                CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();

                byte[] stored = concurrent.get("project:p1").join().orElseThrow();
                assertThat(stored).hasSize(64 * 1024);
                byte first = stored[0];
                assertThat(stored).containsOnly(first);
            }
            try (Stream<Path> files = Files.list(concurrent.getDirectory())) {
                assertThat(files).hasSize(1);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
