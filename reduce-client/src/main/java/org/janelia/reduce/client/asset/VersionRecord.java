package org.janelia.reduce.client.asset;

import java.io.Serializable;
import java.util.Date;

/**
 * Asset management record for one published version of a shot task.
 *
 * @author Eric Trautman
 */
public class VersionRecord
        implements Serializable {

    public static final String OMITTED_STATUS = "omt";

    private final String code;
    private final String shotName;
    private final String taskName;
    private final String status;
    private final String pathToMovie;
    private final Date createTimestamp;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private VersionRecord() {
        this(null, null, null, null, null, null);
    }

    public VersionRecord(final String code,
                         final String shotName,
                         final String taskName,
                         final String status,
                         final String pathToMovie,
                         final Date createTimestamp) {
        this.code = code;
        this.shotName = shotName;
        this.taskName = taskName;
        this.status = status;
        this.pathToMovie = pathToMovie;
        this.createTimestamp = createTimestamp;
    }

    /** @return version code that includes the version label (e.g. sq010_sh0040_taLayerExport_v005). */
    public String getCode() {
        return code;
    }

    public String getShotName() {
        return shotName;
    }

    public String getTaskName() {
        return taskName;
    }

    public String getStatus() {
        return status;
    }

    /** @return path of the movie deliverable for this version. */
    public String getPathToMovie() {
        return pathToMovie;
    }

    public Date getCreateTimestamp() {
        return createTimestamp;
    }

    public boolean isOmitted() {
        return OMITTED_STATUS.equals(status);
    }

    @Override
    public String toString() {
        return "version '" + code + "' (" + status + ")";
    }
}
