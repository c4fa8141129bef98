package org.janelia.reduce.client.asset;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.janelia.reduce.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link PublishRequestFileSink} class.
 *
 * @author Eric Trautman
 */
public class PublishRequestFileSinkTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMddHHmmssSSS");
        testDirectory = new File("target", "test_publish_sink_" + sdf.format(new Date())).getCanonicalFile();
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testPublish() throws Exception {

        final Path queueDirectory = testDirectory.toPath().resolve("queue");
        final Path projectFolder = testDirectory.toPath().resolve("work/sh010_project");

        new PublishRequestFileSink(queueDirectory).publish(projectFolder, 42L, "reduced layers");

        final File[] requestFiles = queueDirectory.toFile().listFiles();
        Assert.assertNotNull("queue directory should be created", requestFiles);
        Assert.assertEquals("invalid number of requests", 1, requestFiles.length);
        Assert.assertTrue("invalid request file name " + requestFiles[0].getName(),
                          requestFiles[0].getName().startsWith("publish_42_"));

        final PublishRequest request = PublishRequest.fromJson(
                new String(Files.readAllBytes(requestFiles[0].toPath()), StandardCharsets.UTF_8));

        Assert.assertEquals("invalid source path", projectFolder.toAbsolutePath().toString(), request.getSourcePath());
        Assert.assertEquals("invalid task id", Long.valueOf(42), request.getTaskId());
        Assert.assertEquals("invalid description", "reduced layers", request.getDescription());
        Assert.assertNotNull("timestamp missing", request.getRequestTimestamp());
    }
}
