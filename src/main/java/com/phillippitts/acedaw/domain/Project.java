package com.phillippitts.acedaw.domain;

import org.json.JSONObject;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A multi-track editing project as persisted in the project library and embedded in archives.
 *
 * <p>Identity is the opaque {@code id}, stable for the project's lifetime. The ordered
 * {@code tracks} list and every field this class does not model (generation defaults, editor
 * view state) travel as-is through save, load, export and import; the latter are held in
 * {@link #attributes()}.
 *
 * <p>Instances are immutable. Invariant: {@code updatedAt >= createdAt}.
 */
public final class Project {

    private final String id;
    private final String name;
    private final long createdAt;
    private final long updatedAt;
    private final List<Track> tracks;
    private final JSONObject attributes;

    /**
     * @param id         non-blank project identity
     * @param name       display name; {@code null} is stored as an empty string
     * @param createdAt  creation time in epoch milliseconds
     * @param updatedAt  last save time in epoch milliseconds, not before {@code createdAt}
     * @param tracks     ordered track stack
     * @param attributes remaining top-level fields, copied; {@code null} means none
     * @throws IllegalArgumentException if id is blank or updatedAt precedes createdAt
     */
    public Project(String id, String name, long createdAt, long updatedAt,
                   List<Track> tracks, JSONObject attributes) {
        Objects.requireNonNull(id, "Project id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Project id must not be blank");
        }
        if (updatedAt < createdAt) {
            throw new IllegalArgumentException("updatedAt (" + updatedAt
                    + ") must not precede createdAt (" + createdAt + ")");
        }
        Objects.requireNonNull(tracks, "Tracks must not be null");
        this.id = id;
        this.name = name == null ? "" : name;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.tracks = List.copyOf(tracks);
        this.attributes = attributes == null ? new JSONObject() : new JSONObject(attributes.toString());
    }

    /**
     * Creates a brand-new empty project whose timestamps are both {@code now}.
     */
    public static Project create(String id, String name, long now) {
        return new Project(id, name, now, now, List.of(), null);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public long createdAt() {
        return createdAt;
    }

    public long updatedAt() {
        return updatedAt;
    }

    public List<Track> tracks() {
        return tracks;
    }

    /**
     * @return a copy of the fields this class does not model
     */
    public JSONObject attributes() {
        return new JSONObject(attributes.toString());
    }

    public Set<String> attributeNames() {
        return Set.copyOf(attributes.keySet());
    }

    public Project withUpdatedAt(long updatedAt) {
        return new Project(id, name, createdAt, updatedAt, tracks, attributes);
    }

    public Project withName(String name) {
        return new Project(id, name, createdAt, updatedAt, tracks, attributes);
    }

    public Project withTracks(List<Track> tracks) {
        return new Project(id, name, createdAt, updatedAt, tracks, attributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Project other)) {
            return false;
        }
        return createdAt == other.createdAt
                && updatedAt == other.updatedAt
                && id.equals(other.id)
                && name.equals(other.name)
                && tracks.equals(other.tracks)
                && attributes.similar(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, createdAt, updatedAt, tracks);
    }

    @Override
    public String toString() {
        return "Project{id=" + id + ", name=" + name + ", createdAt=" + createdAt
                + ", updatedAt=" + updatedAt + ", tracks=" + tracks.size()
                + ", attributes=" + attributes.keySet() + "}";
    }
}
