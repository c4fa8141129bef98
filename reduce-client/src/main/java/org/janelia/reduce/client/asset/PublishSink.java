package org.janelia.reduce.client.asset;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Registers a finished project folder as a new version of a task.
 *
 * @author Eric Trautman
 */
public interface PublishSink {

    void publish(final Path folder,
                 final long taskId,
                 final String description)
            throws IOException;
}
