package com.phillippitts.acedaw.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Listing projection of a {@link Project}. Never stored; always derived from the project it
 * describes so it cannot drift.
 *
 * @param id         project identity
 * @param name       display name
 * @param createdAt  creation time in epoch milliseconds
 * @param updatedAt  last save time in epoch milliseconds
 * @param trackCount number of tracks in the project
 */
public record ProjectSummary(
        String id,
        String name,
        long createdAt,
        long updatedAt,
        int trackCount
) {

    /**
     * Most recently updated first; id breaks ties so listings are deterministic.
     */
    public static final Comparator<ProjectSummary> MOST_RECENT_FIRST =
            Comparator.comparingLong(ProjectSummary::updatedAt).reversed()
                    .thenComparing(ProjectSummary::id);

    public ProjectSummary {
        Objects.requireNonNull(id, "Project id must not be null");
        Objects.requireNonNull(name, "Project name must not be null");
    }

    public static ProjectSummary of(Project project) {
        return new ProjectSummary(
                project.id(),
                project.name(),
                project.createdAt(),
                project.updatedAt(),
                project.tracks().size()
        );
    }
}
