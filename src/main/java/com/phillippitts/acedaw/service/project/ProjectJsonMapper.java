package com.phillippitts.acedaw.service.project;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.domain.Track;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts projects to and from their JSON record form.
 *
 * <p>The same form is used for library records and for the {@code project} member of archive
 * manifests. Fields other than {@code id}, {@code name}, {@code createdAt}, {@code updatedAt} and
 * {@code tracks} are carried through untouched.
 */
public final class ProjectJsonMapper {

    static final String ID = "id";
    static final String NAME = "name";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";
    static final String TRACKS = "tracks";

    private static final Set<String> MODELLED_FIELDS = Set.of(ID, NAME, CREATED_AT, UPDATED_AT, TRACKS);

    private ProjectJsonMapper() {}

    public static JSONObject toJson(Project project) {
        JSONObject json = project.attributes();
        json.put(ID, project.id());
        json.put(NAME, project.name());
        json.put(CREATED_AT, project.createdAt());
        json.put(UPDATED_AT, project.updatedAt());
        JSONArray tracks = new JSONArray();
        for (Track track : project.tracks()) {
            tracks.put(track.toJson());
        }
        json.put(TRACKS, tracks);
        return json;
    }

    /**
     * Reads a project from its JSON form.
     *
     * <p>{@code id} must be a non-blank string and {@code tracks} an array of objects (possibly
     * empty). Missing timestamps read as 0 for {@code createdAt} and {@code createdAt} for
     * {@code updatedAt}; a missing name reads as empty.
     *
     * @throws IllegalArgumentException if the object does not describe a valid project
     */
    public static Project fromJson(JSONObject json) {
        Object id = json.opt(ID);
        if (!(id instanceof String idText) || idText.isBlank()) {
            throw new IllegalArgumentException("Project is missing a string '" + ID + "'");
        }
        Object tracksValue = json.opt(TRACKS);
        if (!(tracksValue instanceof JSONArray trackArray)) {
            throw new IllegalArgumentException("Project '" + idText + "' has no '" + TRACKS + "' array");
        }
        List<Track> tracks = new ArrayList<>(trackArray.length());
        for (int i = 0; i < trackArray.length(); i++) {
            Object element = trackArray.opt(i);
            if (!(element instanceof JSONObject trackJson)) {
                throw new IllegalArgumentException("Track " + i + " of project '" + idText + "' is not an object");
            }
            tracks.add(Track.fromJson(trackJson));
        }

        long createdAt = json.optLong(CREATED_AT, 0L);
        long updatedAt = json.optLong(UPDATED_AT, createdAt);
        String name = json.optString(NAME, "");

        JSONObject attributes = new JSONObject();
        for (String key : json.keySet()) {
            if (!MODELLED_FIELDS.contains(key)) {
                attributes.put(key, json.get(key));
            }
        }
        return new Project(idText, name, createdAt, updatedAt, tracks, attributes);
    }
}
