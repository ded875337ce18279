package com.phillippitts.acedaw.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Archive import/export limits.
 *
 * <p>Note: Bean created via {@code @EnableConfigurationProperties} on
 * {@link com.phillippitts.acedaw.AceDawApplication}.
 */
@ConfigurationProperties(prefix = "acedaw.archive")
@Validated
public class ArchiveProperties {

    /**
     * Largest archive accepted for import, in bytes (guard against memory exhaustion;
     * archives are decoded fully in memory). Default: 512 MB.
     */
    @Positive(message = "Maximum archive size must be positive")
    private long maxSizeBytes = 512L * 1024 * 1024;

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }

    public void setMaxSizeBytes(long maxSizeBytes) {
        this.maxSizeBytes = maxSizeBytes;
    }
}
