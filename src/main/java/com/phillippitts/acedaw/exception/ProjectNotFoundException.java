package com.phillippitts.acedaw.exception;

/**
 * Thrown by workflows that cannot proceed without an existing project (for example export).
 * Plain lookups report absence as an empty {@link java.util.Optional} instead.
 */
public class ProjectNotFoundException extends AceDawException {

    private final String projectId;

    public ProjectNotFoundException(String projectId) {
        super("Project not found: " + projectId);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
