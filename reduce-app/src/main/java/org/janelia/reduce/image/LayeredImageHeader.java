package org.janelia.reduce.image;

import java.util.ArrayList;
import java.util.List;

import org.janelia.reduce.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel metadata stored with each layered image file.
 * The header is kept separately from pixel data so that zero-channel images
 * can still describe their dimensions and sample format.
 *
 * @author Eric Trautman
 */
public class LayeredImageHeader {

    private final Integer width;
    private final Integer height;
    private final SampleFormat sampleFormat;
    private final List<String> channelNames;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private LayeredImageHeader() {
        this(null, null, null, new ArrayList<>());
    }

    public LayeredImageHeader(final Integer width,
                              final Integer height,
                              final SampleFormat sampleFormat,
                              final List<String> channelNames) {
        this.width = width;
        this.height = height;
        this.sampleFormat = sampleFormat;
        this.channelNames = channelNames;
    }

    public LayeredImageHeader(final LayeredImage image) {
        this(image.getWidth(), image.getHeight(), image.getSampleFormat(), image.getChannelNames());
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public SampleFormat getSampleFormat() {
        return sampleFormat;
    }

    public List<String> getChannelNames() {
        return channelNames == null ? new ArrayList<>() : channelNames;
    }

    public boolean isComplete() {
        return (width != null) && (height != null) && (sampleFormat != null) && (channelNames != null);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    /**
     * @return header parsed from the specified JSON, or null if the JSON is missing or is not a header.
     */
    public static LayeredImageHeader fromJson(final String json) {
        LayeredImageHeader header = null;
        if ((json != null) && json.trim().startsWith("{")) {
            try {
                header = JSON_HELPER.fromJson(json.trim());
            } catch (final IllegalArgumentException e) {
                LOG.debug("fromJson: ignoring info that is not a header", e);
            }
        }
        return header;
    }

    private static final JsonUtils.Helper<LayeredImageHeader> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, LayeredImageHeader.class);

    private static final Logger LOG = LoggerFactory.getLogger(LayeredImageHeader.class);
}
