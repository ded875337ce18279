package com.phillippitts.acedaw.domain;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.phillippitts.acedaw.testutil.TestFixtures.project;
import static com.phillippitts.acedaw.testutil.TestFixtures.track;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectTest {

    @Test
    void createSetsBothTimestampsToNow() {
        Project p = Project.create("p1", "Demo", 42L);

        assertThat(p.createdAt()).isEqualTo(42L);
        assertThat(p.updatedAt()).isEqualTo(42L);
        assertThat(p.tracks()).isEmpty();
        assertThat(p.attributeNames()).isEmpty();
    }

    @Test
    void rejectsBlankId() {
        assertThatThrownBy(() -> Project.create("  ", "x", 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("blank");
    }

    @Test
    void rejectsUpdatedBeforeCreated() {
        assertThatThrownBy(() -> new Project("p", "x", 10L, 9L, List.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("updatedAt");
    }

    @Test
    void nullNameBecomesEmpty() {
        assertThat(Project.create("p", null, 1L).name()).isEmpty();
    }

    @Test
    void tracksAreDefensivelyCopied() {
        List<Track> tracks = new ArrayList<>();
        tracks.add(track("t1", "drums"));
        Project p = new Project("p", "x", 1L, 1L, tracks, null);

        tracks.add(track("t2", "bass"));

        assertThat(p.tracks()).hasSize(1);
        assertThatThrownBy(() -> p.tracks().add(track("t3", "keys")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void attributesAreCopiedInAndOut() {
        JSONObject attrs = new JSONObject().put("generationDefaults", new JSONObject().put("bpm", 90));
        Project p = new Project("p", "x", 1L, 1L, List.of(), attrs);

        attrs.put("late", true);
        p.attributes().put("mutated", true);

        assertThat(p.attributeNames()).containsExactly("generationDefaults");
        assertThat(p.attributes().getJSONObject("generationDefaults").getInt("bpm")).isEqualTo(90);
    }

    @Test
    void equalityIsStructural() {
        Project a = project("p1", "Song", 1L, 5L, 2);
        Project b = project("p1", "Song", 1L, 5L, 2);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(a.withName("Other"));
        assertThat(a).isNotEqualTo(a.withUpdatedAt(6L));
        assertThat(a).isNotEqualTo(a.withTracks(List.of()));
    }

    @Test
    void withUpdatedAtKeepsEverythingElse() {
        Project a = project("p1", "Song", 1L, 5L, 3);
        Project b = a.withUpdatedAt(99L);

        assertThat(b.updatedAt()).isEqualTo(99L);
        assertThat(b.id()).isEqualTo(a.id());
        assertThat(b.tracks()).isEqualTo(a.tracks());
        assertThat(b.attributes().similar(a.attributes())).isTrue();
    }
}
