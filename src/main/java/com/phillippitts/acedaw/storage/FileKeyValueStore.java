package com.phillippitts.acedaw.storage;

import com.phillippitts.acedaw.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Directory-backed {@link KeyValueStore}: one file per key.
 *
 * <p>File names are the URL-safe Base64 form of the UTF-8 key plus {@value #FILE_SUFFIX}, so any
 * key maps to a portable name and {@link #listKeys()} can recover keys from names. Each write goes
 * to its own temporary file and is then moved into place, so readers never see half-written values
 * and concurrent writes to one key resolve to whichever move lands last.
 *
 * <p>All I/O runs on the supplied executor; see
 * {@link com.phillippitts.acedaw.config.ThreadPoolConfig#storageExecutor()}.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LogManager.getLogger(FileKeyValueStore.class);

    static final String FILE_SUFFIX = ".bin";
    private static final String TEMP_SUFFIX = ".tmp";

    private static final Base64.Encoder NAME_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder NAME_DECODER = Base64.getUrlDecoder();

    private final Path directory;
    private final Executor executor;

    /**
     * @param directory root directory, created if missing
     * @param executor  executor for blocking file I/O
     * @throws StorageException if the directory cannot be created
     */
    public FileKeyValueStore(Path directory, Executor executor) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.executor = Objects.requireNonNull(executor, "executor");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Failed to create store directory " + directory, e);
        }
        LOG.info("File key-value store at {}", directory.toAbsolutePath());
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(String key) {
        Path file = fileFor(key);
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Optional.of(Files.readAllBytes(file));
            } catch (NoSuchFileException e) {
                return Optional.empty();
            } catch (IOException e) {
                throw new StorageException("Failed to read value", key, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] value) {
        Path file = fileFor(key);
        byte[] copy = Objects.requireNonNull(value, "value").clone();
        return CompletableFuture.runAsync(() -> {
            Path temp = null;
            try {
                // Unique per write: concurrent writers to one key each rename their own file.
                temp = Files.createTempFile(directory, file.getFileName() + ".", TEMP_SUFFIX);
                Files.write(temp, copy);
                moveIntoPlace(temp, file);
                LOG.debug("Wrote {} bytes for key {}", copy.length, key);
            } catch (IOException e) {
                if (temp != null) {
                    deleteQuietly(temp);
                }
                throw new StorageException("Failed to write value", key, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        Path file = fileFor(key);
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new StorageException("Failed to delete value", key, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Set<String>> listKeys() {
        return CompletableFuture.supplyAsync(() -> {
            Set<String> keys = new HashSet<>();
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
                for (Path file : files) {
                    decodeKey(file.getFileName().toString()).ifPresent(keys::add);
                }
            } catch (IOException e) {
                throw new StorageException("Failed to list keys in " + directory, e);
            }
            return Set.copyOf(keys);
        }, executor);
    }

    public Path getDirectory() {
        return directory;
    }

    Path fileFor(String key) {
        Objects.requireNonNull(key, "key");
        String name = NAME_ENCODER.encodeToString(key.getBytes(StandardCharsets.UTF_8));
        return directory.resolve(name + FILE_SUFFIX);
    }

    private static Optional<String> decodeKey(String fileName) {
        String encoded = fileName.substring(0, fileName.length() - FILE_SUFFIX.length());
        try {
            return Optional.of(new String(NAME_DECODER.decode(encoded), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring foreign file in store directory: {}", fileName);
            return Optional.empty();
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Failed to remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
