package org.janelia.reduce.channel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.reduce.image.LayeredImage;
import org.janelia.reduce.image.LayeredImageChannel;
import org.janelia.reduce.image.LayeredImageCodec;
import org.janelia.reduce.image.LayeredImageException;
import org.janelia.reduce.spec.ChannelName;
import org.janelia.reduce.spec.VersionLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites frames using a {@link ChannelClassification}:
 * empty groups are dropped, matte groups keep only their A channel, color override groups keep
 * only their R channel, and every other channel is passed through unchanged.
 * Kept matte and color override channels are renamed to <pre> base.mask </pre> and follow the
 * pass-through channels in the order their groups first appear.
 *
 * @author Eric Trautman
 */
public class ImageRewriter {

    public static final String MATTE_COVERAGE_COMPONENT = "A";
    public static final String COLOR_OVERRIDE_COVERAGE_COMPONENT = "R";

    private final LayeredImageCodec codec;

    public ImageRewriter(final LayeredImageCodec codec) {
        this.codec = codec;
    }

    /**
     * @return reduced copy of the source image (possibly with zero channels).
     */
    public LayeredImage rewrite(final LayeredImage source,
                                final ChannelClassification classification) {

        final List<LayeredImageChannel> passThroughChannels = new ArrayList<>();
        final Map<String, LayeredImageChannel> maskChannelsByBase = new LinkedHashMap<>();

        for (final LayeredImageChannel channel : source.getChannels()) {

            final ChannelName name = channel.getName();
            final String base = name.getBase();

            if (classification.isEmpty(base)) {
                continue;
            }

            final String coverageComponent;
            if (classification.isMatte(base)) {
                coverageComponent = MATTE_COVERAGE_COMPONENT;
            } else if (classification.isColorOverride(base)) {
                coverageComponent = COLOR_OVERRIDE_COVERAGE_COMPONENT;
            } else {
                passThroughChannels.add(channel);
                continue;
            }

            // reserve the group's slot on first sight so masks keep group encounter order
            if (! maskChannelsByBase.containsKey(base)) {
                maskChannelsByBase.put(base, null);
            }
            if (name.hasComponent(coverageComponent)) {
                maskChannelsByBase.put(base, channel.withName(ChannelName.maskNameForBase(base)));
            }
        }

        final List<LayeredImageChannel> reducedChannels = new ArrayList<>(passThroughChannels);
        maskChannelsByBase.forEach((base, maskChannel) -> {
            if (maskChannel == null) {
                LOG.debug("rewrite: group '{}' has no coverage channel, no mask will be derived", base);
            } else {
                reducedChannels.add(maskChannel);
            }
        });

        return new LayeredImage(source.getWidth(), source.getHeight(), source.getSampleFormat(), reducedChannels);
    }

    /**
     * Reads the source frame, reduces it, and writes the result to the destination directory
     * with its version token replaced by the specified label.
     *
     * @return path of the written frame.
     *
     * @throws LayeredImageException
     *   if the source cannot be decoded or the result cannot be written.
     */
    public Path rewriteFile(final Path sourceFrame,
                            final Path destinationDirectory,
                            final String newVersionLabel,
                            final ChannelClassification classification)
            throws LayeredImageException {

        final LayeredImage source = codec.read(sourceFrame);
        final LayeredImage reduced = rewrite(source, classification);
        final Path destinationFrame = VersionLabel.relabel(sourceFrame, destinationDirectory, newVersionLabel);

        codec.write(destinationFrame, reduced);

        LOG.debug("rewriteFile: wrote {} with {} of {} channels",
                  destinationFrame, reduced.getChannelCount(), source.getChannelCount());

        return destinationFrame;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageRewriter.class);
}
