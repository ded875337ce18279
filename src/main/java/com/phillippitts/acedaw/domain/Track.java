package com.phillippitts.acedaw.domain;

import org.json.JSONObject;

import java.util.Objects;

/**
 * One layer of a project's track stack.
 *
 * <p>The persistence layer does not interpret tracks: clip lists, generation prompts and mixer
 * state are kept as the JSON object the editor produced and written back unchanged. Only the
 * optional {@code id} field is exposed.
 */
public final class Track {

    private final JSONObject fields;

    private Track(JSONObject fields) {
        this.fields = fields;
    }

    /**
     * Creates a track from its JSON form. The object is deep-copied, later changes to the
     * argument do not affect the track.
     *
     * @param json the track object as stored by the editor
     * @return a new track
     * @throws NullPointerException if json is null
     */
    public static Track fromJson(JSONObject json) {
        Objects.requireNonNull(json, "Track JSON must not be null");
        return new Track(new JSONObject(json.toString()));
    }

    /**
     * @return the track's {@code id} field, or an empty string when it has none
     */
    public String id() {
        return fields.optString("id", "");
    }

    /**
     * @return a deep copy of the track's JSON form
     */
    public JSONObject toJson() {
        return new JSONObject(fields.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Track other)) {
            return false;
        }
        return fields.similar(other.fields);
    }

    @Override
    public int hashCode() {
        return id().hashCode();
    }

    @Override
    public String toString() {
        return "Track" + fields;
    }
}
