package com.phillippitts.acedaw.service.project;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.domain.ProjectSummary;
import com.phillippitts.acedaw.exception.CorruptProjectRecordException;
import com.phillippitts.acedaw.storage.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;

import static com.phillippitts.acedaw.testutil.TestFixtures.project;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyValueProjectRepositoryTest {

    private InMemoryKeyValueStore store;
    private KeyValueProjectRepository repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        repository = new KeyValueProjectRepository(store);
    }

    @Test
    void loadReturnsProjectExactlyAsSaved() {
        Project p = project("p1", "Song", 100L, 200L, 3);

        repository.save(p).join();

        assertThat(repository.load("p1").join()).contains(p);
        assertThat(store.get("project:p1").join()).isPresent();
    }

    @Test
    void loadOfAbsentIdIsEmpty() {
        assertThat(repository.load("missing").join()).isEmpty();
    }

    @Test
    void saveOverwritesPreviousRecord() {
        repository.save(project("p1", "First", 1L, 1L, 1)).join();
        repository.save(project("p1", "Second", 1L, 2L, 4)).join();

        Project loaded = repository.load("p1").join().orElseThrow();
        assertThat(loaded.name()).isEqualTo("Second");
        assertThat(loaded.tracks()).hasSize(4);
    }

    @Test
    void listIsSortedMostRecentFirst() {
        repository.save(project("a", 10L)).join();
        repository.save(project("b", 30L)).join();
        repository.save(project("c", 20L)).join();

        assertThat(repository.list().join())
                .extracting(ProjectSummary::id)
                .containsExactly("b", "c", "a");
    }

    @Test
    void listBreaksUpdatedAtTiesById() {
        repository.save(project("z", 10L)).join();
        repository.save(project("m", 10L)).join();

        assertThat(repository.list().join()).extracting(ProjectSummary::id).containsExactly("m", "z");
    }

    @Test
    void summaryTrackCountMatchesLoadedProject() {
        repository.save(project("p1", "Song", 1L, 1L, 5)).join();

        ProjectSummary summary = repository.list().join().get(0);
        Project loaded = repository.load("p1").join().orElseThrow();

        assertThat(summary.trackCount()).isEqualTo(loaded.tracks().size()).isEqualTo(5);
        assertThat(summary).isEqualTo(ProjectSummary.of(loaded));
    }

    @Test
    void listIgnoresNonProjectKeys() {
        repository.save(project("p1", 1L)).join();
        store.set("audio:p1:c1:cumulative", new byte[]{1, 2}).join();

        assertThat(repository.list().join()).hasSize(1);
    }

    @Test
    void deleteIsIdempotent() {
        repository.save(project("p1", 1L)).join();

        repository.delete("p1").join();
        repository.delete("p1").join();

        assertThat(repository.load("p1").join()).isEmpty();
        assertThat(repository.list().join()).isEmpty();
    }

    /**
     * One unreadable record must not hide the rest of the library, while a direct load of it
     * still reports the damage instead of pretending it is absent.
     */
    @Test
    void corruptRecordIsSkippedInListButFailsOnLoad() {
        repository.save(project("good", 5L)).join();
        store.set("project:bad", "{not json".getBytes(StandardCharsets.UTF_8)).join();
        store.set("project:noid", "{\"tracks\":[]}".getBytes(StandardCharsets.UTF_8)).join();

        List<ProjectSummary> summaries = repository.list().join();

        assertThat(summaries).extracting(ProjectSummary::id).containsExactly("good");
        assertThatThrownBy(() -> repository.load("bad").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(CorruptProjectRecordException.class);
        assertThatThrownBy(() -> repository.load("noid").join())
                .hasCauseInstanceOf(CorruptProjectRecordException.class);
    }
}
