package org.janelia.reduce.client.asset;

import java.io.Serializable;

/**
 * Asset management record for a shot task.
 *
 * @author Eric Trautman
 */
public class TaskRecord
        implements Serializable {

    private final Long id;
    private final String shotName;
    private final String taskName;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TaskRecord() {
        this(null, null, null);
    }

    public TaskRecord(final Long id,
                      final String shotName,
                      final String taskName) {
        this.id = id;
        this.shotName = shotName;
        this.taskName = taskName;
    }

    public Long getId() {
        return id;
    }

    public String getShotName() {
        return shotName;
    }

    public String getTaskName() {
        return taskName;
    }

    public boolean matches(final String shotName,
                           final String taskName) {
        return shotName.equals(this.shotName) && taskName.equals(this.taskName);
    }
}
