package com.phillippitts.acedaw.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Key-value substrate selection.
 *
 * <p>{@code acedaw.storage.type=file} (default) keeps one file per key under
 * {@code acedaw.storage.directory}; {@code memory} keeps everything on the heap and loses it on
 * shutdown.
 *
 * <p>Note: Bean created via {@code @EnableConfigurationProperties} on
 * {@link com.phillippitts.acedaw.AceDawApplication}.
 */
@ConfigurationProperties(prefix = "acedaw.storage")
@Validated
public class StorageProperties {

    public enum StorageType {
        FILE,
        MEMORY
    }

    @NotNull(message = "Storage type must be set")
    private StorageType type = StorageType.FILE;

    @NotBlank(message = "Storage directory must not be blank")
    private String directory = Paths.get(System.getProperty("user.home"), ".acedaw", "store").toString();

    public StorageType getType() {
        return type;
    }

    public void setType(StorageType type) {
        this.type = type;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public Path directoryPath() {
        return Paths.get(directory);
    }
}
