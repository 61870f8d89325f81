package com.projectkb;

import java.util.Set;

/** Fixed project list, e.g. from configuration. */
public class StaticProjectRegistry implements ProjectRegistry {
    private final Set<String> projects;

    public StaticProjectRegistry(Set<String> projects) {
        this.projects = Set.copyOf(projects);
    }

    @Override
    public boolean exists(String projectId) {
        return projectId != null && projects.contains(projectId);
    }
}
