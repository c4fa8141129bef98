package org.janelia.reduce.pipeline;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.Collections;

import org.janelia.reduce.image.LayeredImage;
import org.janelia.reduce.image.LayeredImageException;
import org.janelia.reduce.image.TestImages;
import org.janelia.reduce.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import static org.janelia.reduce.image.TestImages.channel;

/**
 * Tests the {@link LayerProcessor} class.
 *
 * @author Eric Trautman
 */
public class LayerProcessorTest {

    private File testDirectory;
    private Path sourceLayers;
    private Path destinationLayers;
    private final LayerProcessor processor = new LayerProcessor(TestImages.CODEC);

    @Before
    public void setup() throws Exception {
        testDirectory = TestImages.createTestDirectory("test_layer_processor");
        sourceLayers = testDirectory.toPath().resolve("source/layers");
        destinationLayers = testDirectory.toPath().resolve("work/layers");
        Files.createDirectories(destinationLayers);
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testBuildSequencePattern() {
        Assert.assertEquals("invalid pattern", "beauty_v006.@@@@.tif",
                            LayerProcessor.buildSequencePattern("beauty_v006.0001.tif"));
        Assert.assertEquals("invalid pattern", "fx.v002.@@.tiff",
                            LayerProcessor.buildSequencePattern("fx.v002.12.tiff"));
        Assert.assertEquals("name without frame number should not change", "bg_v006.xstage",
                            LayerProcessor.buildSequencePattern("bg_v006.xstage"));
    }

    @Test
    public void testProcessRasterLayer() throws Exception {

        final Path version = Files.createDirectories(sourceLayers.resolve("fx/v002"));
        TestImages.writeFrame(version, "fx_v002.0001.tif",
                              channel("beauty.R", 1), channel("fx_smoke_matte.A", 0), channel("spec.R", 0));
        TestImages.writeFrame(version, "fx_v002.0002.tif",
                              channel("beauty.R", 2), channel("fx_smoke_matte.A", 3), channel("spec.R", 0));

        final Path sourceFrame = version.resolve("fx_v002.0002.tif");
        final byte[] sourceBytes = Files.readAllBytes(sourceFrame);
        final FileTime sourceModified = Files.getLastModifiedTime(sourceFrame);

        final LayerResult result = processor.process("fx", sourceLayers, destinationLayers,
                                                     Collections.emptyList(), "v002");

        Assert.assertTrue("layer should be done, failure is " + result.getFailureMessage(), result.isDone());
        Assert.assertEquals("invalid written count", 2, result.getWrittenFileCount());
        Assert.assertEquals("invalid output pattern", "fx_v002.@@@@.tif", result.getOutputPattern());
        Assert.assertEquals("invalid destination", destinationLayers.resolve("fx"), result.getDestinationPath());

        final LayeredImage written = TestImages.CODEC.read(destinationLayers.resolve("fx/fx_v002.0002.tif"));
        Assert.assertEquals("invalid channels",
                            Arrays.asList("beauty.R", "fx_smoke_matte.mask"), written.getChannelNames());

        Assert.assertArrayEquals("source frame content should not change", sourceBytes, Files.readAllBytes(sourceFrame));
        Assert.assertEquals("source frame should not be touched", sourceModified, Files.getLastModifiedTime(sourceFrame));
        Assert.assertEquals("source version should keep its frames", 2, FileUtil.listSorted(version).size());
    }

    @Test
    public void testProcessFallsBackToAcceptableVersion() throws Exception {

        final Path version = Files.createDirectories(sourceLayers.resolve("bg/v001"));
        Files.write(version.resolve("bg_v001.xstage"), "stage".getBytes(StandardCharsets.UTF_8));

        final LayerResult result = processor.process("bg", sourceLayers, destinationLayers,
                                                     Collections.singletonList("shot010_taLayerExport_v001"),
                                                     "v004");

        Assert.assertTrue("layer should be done, failure is " + result.getFailureMessage(), result.isDone());
        Assert.assertEquals("invalid source version", version, result.getSourceVersionPath());
        Assert.assertTrue("verbatim copy should be relabeled",
                          Files.isRegularFile(destinationLayers.resolve("bg/bg_v001.xstage")));
        Assert.assertFalse("verbatim copy should not be a raster sequence",
                           result.getClassification().isRasterSequence());
    }

    @Test
    public void testMissingLayerFailsDuringResolving() {

        final LayerResult result = processor.process("missing", sourceLayers, destinationLayers,
                                                     Collections.emptyList(), "v002");

        Assert.assertTrue("layer should fail", result.isFailed());
        Assert.assertEquals("invalid failure stage", LayerState.RESOLVING, result.getFailedDuring());
        Assert.assertNotNull("failure message missing", result.getFailureMessage());
    }

    @Test
    public void testCorruptFrameFailsDuringRewriting() throws Exception {

        final Path version = Files.createDirectories(sourceLayers.resolve("paint/v002"));
        TestImages.writeFrame(version, "paint_v002.0001.tif", channel("beauty.R", 1));
        TestImages.writeCorruptFrame(version, "paint_v002.0002.tif");

        final LayerResult result = processor.process("paint", sourceLayers, destinationLayers,
                                                     Collections.emptyList(), "v002");

        Assert.assertTrue("layer should fail", result.isFailed());
        Assert.assertEquals("invalid failure stage", LayerState.REWRITING, result.getFailedDuring());
        Assert.assertEquals("invalid source version", version, result.getSourceVersionPath());
        Assert.assertTrue("cause should be a decoding failure",
                          result.getFailureCause() instanceof LayeredImageException);
    }
}
