package org.janelia.reduce.client.asset;

import java.io.IOException;
import java.util.List;

/**
 * Asset management queries used to find the versions of a shot task.
 *
 * @author Eric Trautman
 */
public interface VersionRecordSource {

    /**
     * @return identifier of the task, or null if the shot has no such task.
     *
     * @throws IOException
     *   if the query fails.
     */
    Long findTaskId(final String shotName,
                    final String taskName)
            throws IOException;

    /**
     * @return all versions (including omitted ones) of the task, newest first.
     *
     * @throws IOException
     *   if the query fails.
     */
    List<VersionRecord> findVersionsForShotTask(final String shotName,
                                                final String taskName)
            throws IOException;
}
