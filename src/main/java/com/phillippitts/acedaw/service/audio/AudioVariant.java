package com.phillippitts.acedaw.service.audio;

import java.util.Locale;
import java.util.Optional;

/**
 * Which rendering of a clip's audio a blob holds.
 */
public enum AudioVariant {

    /** Mix of every layer up to and including the clip's track, as produced by generation. */
    CUMULATIVE("cumulative"),

    /** The clip's own layer, derived by subtracting the previous cumulative mix. */
    ISOLATED("isolated");

    private final String keySegment;

    AudioVariant(String keySegment) {
        this.keySegment = keySegment;
    }

    /**
     * @return the lower-case form used in storage keys
     */
    public String keySegment() {
        return keySegment;
    }

    /**
     * Parses a key segment ({@code "cumulative"}, {@code "isolated"}), ignoring case.
     */
    public static Optional<AudioVariant> fromKeySegment(String segment) {
        if (segment == null) {
            return Optional.empty();
        }
        String normalized = segment.trim().toLowerCase(Locale.ROOT);
        for (AudioVariant v : values()) {
            if (v.keySegment.equals(normalized)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
