package de.bsommerfeld.sysml.sql.api;

import java.util.Objects;

/**
 * Chooses the project to fetch: by exact id, or by a name prefix that has
 * to match exactly one project.
 */
public record ProjectSelector(String projectId, String namePrefix) {

    public ProjectSelector {
        if ((projectId == null) == (namePrefix == null)) {
            throw new IllegalArgumentException("Exactly one of project id and project name is required");
        }
    }

    public static ProjectSelector byId(String projectId) {
        return new ProjectSelector(Objects.requireNonNull(projectId), null);
    }

    public static ProjectSelector byName(String namePrefix) {
        return new ProjectSelector(null, Objects.requireNonNull(namePrefix));
    }

    @Override
    public String toString() {
        return projectId != null ? "project " + projectId : "project named '" + namePrefix + "*'";
    }
}
