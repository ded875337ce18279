package com.phillippitts.acedaw.testutil;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.domain.Track;
import com.phillippitts.acedaw.service.audio.SampleBuffer;
import com.phillippitts.acedaw.service.audio.WavEncoder;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for projects and WAV payloads used across tests.
 */
public final class TestFixtures {

    private TestFixtures() {}

    public static Track track(String id, String prompt) {
        return Track.fromJson(new JSONObject()
                .put("id", id)
                .put("prompt", prompt)
                .put("clips", new JSONArray().put(new JSONObject().put("id", id + "-clip").put("start", 0))));
    }

    public static Project project(String id, String name, long createdAt, long updatedAt, int trackCount) {
        List<Track> tracks = new ArrayList<>();
        for (int i = 0; i < trackCount; i++) {
            tracks.add(track(id + "-t" + i, "layer " + i));
        }
        JSONObject attributes = new JSONObject()
                .put("generationDefaults", new JSONObject().put("bpm", 120).put("key", "C minor"));
        return new Project(id, name, createdAt, updatedAt, tracks, attributes);
    }

    public static Project project(String id, long updatedAt) {
        return project(id, "Project " + id, 1_000L, updatedAt, 1);
    }

    /**
     * @return a mono PCM16 WAV holding the given samples
     */
    public static byte[] monoWav(int sampleRate, float... samples) {
        return WavEncoder.encodePcm16(new SampleBuffer(sampleRate, new float[][]{samples}));
    }

    public static byte[] stereoWav(int sampleRate, float[] left, float[] right) {
        return WavEncoder.encodePcm16(new SampleBuffer(sampleRate, new float[][]{left, right}));
    }
}
