package com.projectkb;

/**
 * Which projects exist. Project and membership management live outside this library; the core
 * only needs to reject unknown projects.
 */
public interface ProjectRegistry {
    boolean exists(String projectId);

    static ProjectRegistry anyProject() {
        return projectId -> projectId != null && !projectId.isBlank();
    }
}
