package org.janelia.reduce.client.asset;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.reduce.json.JsonUtils;

/**
 * JSON document with the task and version records of a project.
 *
 * @author Eric Trautman
 */
public class VersionCatalog
        implements Serializable {

    private final List<TaskRecord> tasks;
    private final List<VersionRecord> versions;

    public VersionCatalog() {
        this(new ArrayList<>(), new ArrayList<>());
    }

    public VersionCatalog(final List<TaskRecord> tasks,
                          final List<VersionRecord> versions) {
        this.tasks = tasks;
        this.versions = versions;
    }

    public List<TaskRecord> getTasks() {
        return tasks == null ? new ArrayList<>() : tasks;
    }

    public List<VersionRecord> getVersions() {
        return versions == null ? new ArrayList<>() : versions;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static final JsonUtils.Helper<VersionCatalog> JSON_HELPER = new JsonUtils.Helper<>(VersionCatalog.class);
}
