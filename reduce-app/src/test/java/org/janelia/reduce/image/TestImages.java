package org.janelia.reduce.image;

import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.SimpleDateFormat;
import java.util.Arrays;
import java.util.Date;

/**
 * Shared helpers for building and writing test images.
 *
 * @author Eric Trautman
 */
public class TestImages {

    public static final int WIDTH = 4;
    public static final int HEIGHT = 3;

    public static final ImageJTiffCodec CODEC = new ImageJTiffCodec();

    /**
     * @return float channel whose pixels are all zero except for the first pixel, which has the specified value.
     */
    public static LayeredImageChannel channel(final String name,
                                              final float firstPixelValue) {
        final ImageProcessor processor = SampleFormat.FLOAT32.createProcessor(WIDTH, HEIGHT);
        processor.setf(0, firstPixelValue);
        return new LayeredImageChannel(name, processor);
    }

    /**
     * @return float channel with a distinct ramp of values (offset, offset + 1, ...).
     */
    public static LayeredImageChannel rampChannel(final String name,
                                                  final float offset) {
        final ImageProcessor processor = SampleFormat.FLOAT32.createProcessor(WIDTH, HEIGHT);
        for (int i = 0; i < processor.getPixelCount(); i++) {
            processor.setf(i, offset + i);
        }
        return new LayeredImageChannel(name, processor);
    }

    public static LayeredImage image(final LayeredImageChannel... channels) {
        return new LayeredImage(WIDTH, HEIGHT, SampleFormat.FLOAT32, Arrays.asList(channels));
    }

    public static Path writeFrame(final Path directory,
                                  final String fileName,
                                  final LayeredImageChannel... channels)
            throws IOException {
        final Path path = directory.resolve(fileName);
        CODEC.write(path, image(channels));
        return path;
    }

    public static Path writeCorruptFrame(final Path directory,
                                         final String fileName)
            throws IOException {
        final Path path = directory.resolve(fileName);
        Files.write(path, "this is not a tiff file".getBytes(StandardCharsets.UTF_8));
        return path;
    }

    public static float[] pixels(final LayeredImageChannel channel) {
        return (float[]) channel.getPixels().getPixels();
    }

    public static File createTestDirectory(final String baseName)
            throws IOException {
        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMddHHmmssSSS");
        final String timestamp = sdf.format(new Date());
        final File testDirectory = new File("target", baseName + "_" + timestamp).getCanonicalFile();
        if (! testDirectory.mkdirs()) {
            throw new IOException("failed to create " + testDirectory.getAbsolutePath());
        }
        return testDirectory;
    }
}
