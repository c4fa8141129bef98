package org.janelia.reduce.image;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory multi-channel image: dimensions, sample format, and an ordered list of named channels.
 * Zero-channel images are valid.
 *
 * @author Eric Trautman
 */
public class LayeredImage {

    private final int width;
    private final int height;
    private final SampleFormat sampleFormat;
    private final List<LayeredImageChannel> channels;

    public LayeredImage(final int width,
                        final int height,
                        final SampleFormat sampleFormat,
                        final List<LayeredImageChannel> channels)
            throws IllegalArgumentException {

        for (final LayeredImageChannel channel : channels) {
            if ((channel.getPixels().getWidth() != width) || (channel.getPixels().getHeight() != height)) {
                throw new IllegalArgumentException(
                        "channel " + channel + " dimensions do not match image dimensions " + width + "x" + height);
            }
            if (! sampleFormat.matches(channel.getPixels())) {
                throw new IllegalArgumentException(
                        "channel " + channel + " does not have sample format " + sampleFormat);
            }
        }

        this.width = width;
        this.height = height;
        this.sampleFormat = sampleFormat;
        this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public SampleFormat getSampleFormat() {
        return sampleFormat;
    }

    public List<LayeredImageChannel> getChannels() {
        return channels;
    }

    public int getChannelCount() {
        return channels.size();
    }

    public List<String> getChannelNames() {
        return channels.stream()
                .map(c -> c.getName().getFullName())
                .collect(Collectors.toList());
    }

    public LayeredImageChannel getChannel(final String fullName) {
        for (final LayeredImageChannel channel : channels) {
            if (channel.getName().getFullName().equals(fullName)) {
                return channel;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return width + "x" + height + " " + sampleFormat + " image with channels " + getChannelNames();
    }
}
