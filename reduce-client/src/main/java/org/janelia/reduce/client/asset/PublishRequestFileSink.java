package org.janelia.reduce.client.asset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each publish request as a JSON file into a queue directory watched by the publishing service.
 *
 * @author Eric Trautman
 */
public class PublishRequestFileSink
        implements PublishSink {

    private final Path queueDirectory;

    public PublishRequestFileSink(final Path queueDirectory) {
        this.queueDirectory = queueDirectory;
    }

    @Override
    public void publish(final Path folder,
                        final long taskId,
                        final String description)
            throws IOException {

        final Date now = new Date();
        final PublishRequest request = new PublishRequest(folder.toAbsolutePath().toString(),
                                                          taskId,
                                                          description,
                                                          now);

        final String timestamp = new SimpleDateFormat("yyyyMMdd_HHmmss_SSS").format(now);
        final Path requestPath = queueDirectory.resolve("publish_" + taskId + "_" + timestamp + ".json");

        Files.createDirectories(queueDirectory);
        Files.write(requestPath, request.toJson().getBytes(StandardCharsets.UTF_8));

        LOG.info("publish: wrote request for {} to {}", folder, requestPath);
    }

    private static final Logger LOG = LoggerFactory.getLogger(PublishRequestFileSink.class);
}
