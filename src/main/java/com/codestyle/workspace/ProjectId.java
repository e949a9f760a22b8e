package com.codestyle.workspace;

import java.util.Objects;
import java.util.UUID;

/**
 * Stable identity of a project across workspace snapshots.
 */
public final class ProjectId {
    private final UUID id;
    private final String debugName;

    private ProjectId(UUID id, String debugName) {
        this.id = id;
        this.debugName = debugName;
    }

    public static ProjectId createNewId(String debugName) {
        return new ProjectId(UUID.randomUUID(), debugName);
    }

    public UUID getId() {
        return id;
    }

    public String getDebugName() {
        return debugName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectId)) return false;
        return id.equals(((ProjectId) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "(ProjectId " + debugName + ")";
    }
}
