package org.janelia.reduce.util;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.janelia.reduce.image.TestImages;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link FileUtil} class.
 *
 * @author Eric Trautman
 */
public class FileUtilTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = TestImages.createTestDirectory("test_file_util");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testClearReadOnlyRecursive() throws Exception {

        final Path nested = Files.createDirectories(testDirectory.toPath().resolve("project/layers"));
        final Path file = Files.write(nested.resolve("scene.xstage"), "scene".getBytes(StandardCharsets.UTF_8));
        Assert.assertTrue("failed to make file read-only", file.toFile().setReadOnly());

        final List<Path> failedPaths = FileUtil.clearReadOnlyRecursive(testDirectory.toPath().resolve("project"));

        Assert.assertTrue("no failures expected, found " + failedPaths, failedPaths.isEmpty());
        Assert.assertTrue("file should be writable", file.toFile().canWrite());
    }

    @Test
    public void testClearReadOnlyRecursiveWithMissingRoot() {
        final Path missing = testDirectory.toPath().resolve("missing");
        final List<Path> failedPaths = FileUtil.clearReadOnlyRecursive(missing);
        Assert.assertEquals("missing root should be reported", List.of(missing), failedPaths);
    }

    @Test
    public void testListSorted() throws Exception {
        final Path root = testDirectory.toPath();
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("a"));
        Files.createDirectories(root.resolve("c"));

        Assert.assertEquals("invalid order",
                            Arrays.asList(root.resolve("a"), root.resolve("b"), root.resolve("c")),
                            FileUtil.listSorted(root));
    }
}
