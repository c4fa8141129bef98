package org.janelia.reduce.image;

import ij.process.ImageProcessor;

import org.janelia.reduce.spec.ChannelName;

/**
 * A named channel and its pixels.
 *
 * @author Eric Trautman
 */
public class LayeredImageChannel {

    private final ChannelName name;
    private final ImageProcessor pixels;

    public LayeredImageChannel(final String name,
                               final ImageProcessor pixels) {
        this(new ChannelName(name), pixels);
    }

    public LayeredImageChannel(final ChannelName name,
                               final ImageProcessor pixels) {
        this.name = name;
        this.pixels = pixels;
    }

    public ChannelName getName() {
        return name;
    }

    public ImageProcessor getPixels() {
        return pixels;
    }

    /**
     * @return a channel with the specified name that shares this channel's pixels.
     */
    public LayeredImageChannel withName(final String newName) {
        return new LayeredImageChannel(newName, pixels);
    }

    /**
     * @return maximum sample value in this channel (0 for an empty processor).
     */
    public double getMaxValue() {
        final int pixelCount = pixels.getPixelCount();
        double max = pixelCount > 0 ? pixels.getf(0) : 0;
        for (int i = 1; i < pixelCount; i++) {
            final float value = pixels.getf(i);
            if (value > max) {
                max = value;
            }
        }
        return max;
    }

    @Override
    public String toString() {
        return name.getFullName();
    }
}
