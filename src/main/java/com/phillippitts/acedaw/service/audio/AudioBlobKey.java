package com.phillippitts.acedaw.service.audio;

import java.util.Objects;
import java.util.Optional;

/**
 * Storage address of one audio payload: {@code audio:<projectId>:<clipId>:<variant>}.
 *
 * <p>Ids must not contain the {@value #DELIMITER} delimiter, which keeps the mapping injective
 * and lets {@link #parse(String)} recover all three parts. Every key of a project starts with
 * {@link #projectPrefix(String)}, which is what bulk deletion and export enumerate by.
 *
 * @param projectId owning project
 * @param clipId    clip within the project
 * @param variant   cumulative or isolated rendering
 */
public record AudioBlobKey(String projectId, String clipId, AudioVariant variant) {

    public static final String PREFIX = "audio:";
    public static final char DELIMITER = ':';

    public AudioBlobKey {
        requireSegment(projectId, "projectId");
        requireSegment(clipId, "clipId");
        Objects.requireNonNull(variant, "variant must not be null");
    }

    /**
     * @return the string key the payload is stored under
     */
    public String toKey() {
        return PREFIX + projectId + DELIMITER + clipId + DELIMITER + variant.keySegment();
    }

    /**
     * @return the prefix shared by all audio keys of the project
     */
    public static String projectPrefix(String projectId) {
        requireSegment(projectId, "projectId");
        return PREFIX + projectId + DELIMITER;
    }

    /**
     * Splits a stored key back into its parts.
     *
     * @return the key's parts, or empty when the string is not a well-formed audio key
     */
    public static Optional<AudioBlobKey> parse(String key) {
        if (key == null || !key.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String[] parts = key.substring(PREFIX.length()).split(String.valueOf(DELIMITER), -1);
        if (parts.length != 3 || parts[0].isBlank() || parts[1].isBlank()) {
            return Optional.empty();
        }
        return AudioVariant.fromKeySegment(parts[2])
                .filter(v -> v.keySegment().equals(parts[2]))
                .map(v -> new AudioBlobKey(parts[0], parts[1], v));
    }

    private static void requireSegment(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (value.indexOf(DELIMITER) >= 0) {
            throw new IllegalArgumentException(name + " must not contain '" + DELIMITER + "': " + value);
        }
    }

    @Override
    public String toString() {
        return toKey();
    }
}
