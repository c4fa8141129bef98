package org.janelia.reduce.layout;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.reduce.image.TestImages;
import org.janelia.reduce.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link FolderPreparation} class.
 *
 * @author Eric Trautman
 */
public class FolderPreparationTest {

    private File testDirectory;
    private Path exportRoot;
    private Path movie;
    private Path workspace;

    @Before
    public void setup() throws Exception {
        testDirectory = TestImages.createTestDirectory("test_folder_preparation");

        exportRoot = testDirectory.toPath().resolve("shows/demo/shot010/taLayerExport");

        final Path projectFolder = exportRoot.resolve("source/v004/shot010_project");
        Files.createDirectories(projectFolder);
        Files.write(projectFolder.resolve("shot010.xstage"), "scene".getBytes(StandardCharsets.UTF_8));
        projectFolder.resolve("shot010.xstage").toFile().setReadOnly();

        final Path movieFolder = exportRoot.resolve("movies/v004");
        Files.createDirectories(movieFolder);
        movie = Files.write(movieFolder.resolve("shot010_v004.mov"), "movie".getBytes(StandardCharsets.UTF_8));

        workspace = testDirectory.toPath().resolve("workspaces/jdoe");
        Files.createDirectories(workspace);
    }

    @After
    public void tearDown() {
        FileUtil.clearReadOnlyRecursive(testDirectory.toPath());
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testStage() throws Exception {

        final StagedProject staged = new FolderPreparation().stage(movie, workspace);

        final Path expectedProject = workspace.resolve(FolderPreparation.STAGING_FOLDER_NAME).resolve("shot010_project");

        Assert.assertEquals("invalid project folder", expectedProject, staged.getProjectFolder());
        Assert.assertEquals("invalid version", "v004", staged.getVersionLabel());
        Assert.assertEquals("invalid source layers", exportRoot.resolve("layers"), staged.getSourceLayersFolder());
        Assert.assertTrue("layers folder missing", Files.isDirectory(staged.getLayersFolder()));
        Assert.assertTrue("movie not copied",
                          Files.isRegularFile(staged.getClipsFolder().resolve("shot010_v004.mov")));

        final Path stagedScene = expectedProject.resolve("shot010.xstage");
        Assert.assertTrue("scene not copied", Files.isRegularFile(stagedScene));
        Assert.assertTrue("scene should be writable", stagedScene.toFile().canWrite());
    }

    @Test
    public void testStageLeavesSourceReadOnly() throws Exception {

        final Path sourceScene = exportRoot.resolve("source/v004/shot010_project/shot010.xstage");

        // privileged users can always write, so read-only flags cannot be observed
        Assume.assumeFalse("read-only flag is not observable for this user", sourceScene.toFile().canWrite());

        final StagedProject staged = new FolderPreparation().stage(movie, workspace);

        Assert.assertTrue("staged scene should be writable",
                          staged.getProjectFolder().resolve("shot010.xstage").toFile().canWrite());
        Assert.assertFalse("source scene should stay read-only", sourceScene.toFile().canWrite());
        Assert.assertEquals("source scene content should not change",
                            "scene",
                            new String(Files.readAllBytes(sourceScene), StandardCharsets.UTF_8));
    }

    @Test(expected = StagingException.class)
    public void testMissingWorkspace() throws Exception {
        new FolderPreparation().stage(movie, testDirectory.toPath().resolve("workspaces/nobody"));
    }

    @Test(expected = StagingException.class)
    public void testMissingSourceVersion() throws Exception {
        final Path movieFolder = exportRoot.resolve("movies/v009");
        Files.createDirectories(movieFolder);
        final Path otherMovie = Files.write(movieFolder.resolve("shot010_v009.mov"),
                                            "movie".getBytes(StandardCharsets.UTF_8));
        new FolderPreparation().stage(otherMovie, workspace);
    }

    @Test
    public void testDeliverableOutsideExportFolder() throws Exception {
        final Path strayMovie = Files.write(testDirectory.toPath().resolve("shot010_v004.mov"),
                                            "movie".getBytes(StandardCharsets.UTF_8));
        try {
            new FolderPreparation().stage(strayMovie, workspace);
            Assert.fail("path without deliverable folder should fail");
        } catch (final StagingException e) {
            Assert.assertTrue("message should name the path, message is " + e.getMessage(),
                              e.getMessage().contains(strayMovie.toString()));
        }
    }

    @Test
    public void testCustomDeliverableFolderName() throws Exception {
        final Path customExportRoot = testDirectory.toPath().resolve("shows/demo/shot020/layerDelivery");
        Files.createDirectories(customExportRoot.resolve("source/v001/project"));
        Files.write(customExportRoot.resolve("source/v001/project/scene.xstage"),
                    "scene".getBytes(StandardCharsets.UTF_8));
        Files.createDirectories(customExportRoot.resolve("v001"));
        final Path customMovie = Files.write(customExportRoot.resolve("v001/shot020.mov"),
                                             "movie".getBytes(StandardCharsets.UTF_8));

        final StagedProject staged = new FolderPreparation("layerDelivery").stage(customMovie, workspace);

        Assert.assertEquals("invalid version", "v001", staged.getVersionLabel());
        Assert.assertEquals("invalid source layers",
                            customExportRoot.resolve("layers"), staged.getSourceLayersFolder());
    }
}
