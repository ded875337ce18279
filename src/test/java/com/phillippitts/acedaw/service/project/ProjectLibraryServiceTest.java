package com.phillippitts.acedaw.service.project;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.exception.ProjectNotFoundException;
import com.phillippitts.acedaw.service.audio.AudioVariant;
import com.phillippitts.acedaw.service.audio.KeyValueAudioBlobStore;
import com.phillippitts.acedaw.storage.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletionException;

import static com.phillippitts.acedaw.testutil.TestFixtures.project;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectLibraryServiceTest {

    private static final long NOW = 1_700_000_000_000L;

    private KeyValueProjectRepository repository;
    private KeyValueAudioBlobStore blobs;
    private ProjectLibraryService library;

    @BeforeEach
    void setUp() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        repository = new KeyValueProjectRepository(store);
        blobs = new KeyValueAudioBlobStore(store);
        library = new ProjectLibraryService(repository, blobs,
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void createStoresEmptyProjectWithFreshId() {
        Project a = library.create("Demo").join();
        Project b = library.create("Demo").join();

        assertThat(a.id()).isNotBlank().isNotEqualTo(b.id());
        assertThat(a.createdAt()).isEqualTo(NOW);
        assertThat(a.updatedAt()).isEqualTo(NOW);
        assertThat(a.tracks()).isEmpty();
        assertThat(repository.load(a.id()).join()).contains(a);
    }

    @Test
    void saveStampsUpdatedAt() {
        Project stored = library.save(project("p1", "Song", 10L, 20L, 2)).join();

        assertThat(stored.updatedAt()).isEqualTo(NOW);
        assertThat(stored.createdAt()).isEqualTo(10L);
        assertThat(repository.load("p1").join()).contains(stored);
    }

    @Test
    void saveNeverStampsBeforeCreatedAt() {
        Project fromTheFuture = project("p1", "Song", NOW + 5_000L, NOW + 5_000L, 0);

        Project stored = library.save(fromTheFuture).join();

        assertThat(stored.updatedAt()).isEqualTo(NOW + 5_000L);
    }

    @Test
    void openFailsForUnknownProject() {
        assertThatThrownBy(() -> library.open("ghost").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ProjectNotFoundException.class);
    }

    @Test
    void deleteWithAudioRemovesRecordAndOnlyItsBlobs() {
        repository.save(project("p1", 1L)).join();
        repository.save(project("p2", 1L)).join();
        blobs.save("p1", "c1", AudioVariant.CUMULATIVE, new byte[]{1}).join();
        blobs.save("p1", "c1", AudioVariant.ISOLATED, new byte[]{2}).join();
        blobs.save("p2", "c1", AudioVariant.CUMULATIVE, new byte[]{3}).join();

        int removed = library.deleteWithAudio("p1").join();

        assertThat(removed).isEqualTo(2);
        assertThat(repository.load("p1").join()).isEmpty();
        assertThat(blobs.listKeys("p1").join()).isEmpty();
        assertThat(blobs.listKeys("p2").join()).containsExactly("audio:p2:c1:cumulative");
        assertThat(library.list().join()).hasSize(1);
    }
}
