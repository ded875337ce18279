package com.phillippitts.acedaw.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioBlobKeyTest {

    @Test
    void formatsKeyDeterministically() {
        AudioBlobKey key = new AudioBlobKey("p1", "c7", AudioVariant.ISOLATED);

        assertThat(key.toKey()).isEqualTo("audio:p1:c7:isolated");
        assertThat(key.toKey()).isEqualTo(new AudioBlobKey("p1", "c7", AudioVariant.ISOLATED).toKey());
        assertThat(key.toKey()).startsWith(AudioBlobKey.projectPrefix("p1"));
    }

    @Test
    void differentTriplesNeverCollide() {
        assertThat(new AudioBlobKey("p1", "c1", AudioVariant.CUMULATIVE).toKey())
                .isNotEqualTo(new AudioBlobKey("p1", "c1", AudioVariant.ISOLATED).toKey())
                .isNotEqualTo(new AudioBlobKey("p1", "c2", AudioVariant.CUMULATIVE).toKey())
                .isNotEqualTo(new AudioBlobKey("p2", "c1", AudioVariant.CUMULATIVE).toKey());
    }

    @Test
    void projectPrefixDoesNotMatchLongerProjectIds() {
        String key = new AudioBlobKey("p10", "c1", AudioVariant.CUMULATIVE).toKey();

        assertThat(key).doesNotStartWith(AudioBlobKey.projectPrefix("p1"));
    }

    @Test
    void rejectsDelimiterInIds() {
        assertThatThrownBy(() -> new AudioBlobKey("a:b", "c", AudioVariant.CUMULATIVE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("projectId");
        assertThatThrownBy(() -> new AudioBlobKey("a", "b:c", AudioVariant.CUMULATIVE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("clipId");
    }

    @Test
    void rejectsBlankIds() {
        assertThatThrownBy(() -> new AudioBlobKey(" ", "c", AudioVariant.CUMULATIVE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseRecoversAllParts() {
        assertThat(AudioBlobKey.parse("audio:p1:c7:cumulative"))
                .contains(new AudioBlobKey("p1", "c7", AudioVariant.CUMULATIVE));
    }

    @Test
    void parseRejectsMalformedKeys() {
        assertThat(AudioBlobKey.parse("project:p1")).isEmpty();
        assertThat(AudioBlobKey.parse("audio:p1:c7")).isEmpty();
        assertThat(AudioBlobKey.parse("audio:p1:c7:stems")).isEmpty();
        assertThat(AudioBlobKey.parse("audio:p1:c7:ISOLATED")).isEmpty();
        assertThat(AudioBlobKey.parse("audio:p1:c7:isolated:extra")).isEmpty();
        assertThat(AudioBlobKey.parse("audio::c7:isolated")).isEmpty();
        assertThat(AudioBlobKey.parse(null)).isEmpty();
    }

    @Test
    void variantSegmentsParseIgnoringCase() {
        assertThat(AudioVariant.fromKeySegment("Isolated")).contains(AudioVariant.ISOLATED);
        assertThat(AudioVariant.fromKeySegment("mixdown")).isEmpty();
    }
}
