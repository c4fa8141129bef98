package org.janelia.reduce.channel;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.janelia.reduce.image.LayeredImage;
import org.janelia.reduce.image.LayeredImageChannel;
import org.janelia.reduce.image.LayeredImageCodec;
import org.janelia.reduce.image.LayeredImageException;
import org.janelia.reduce.spec.ChannelName;
import org.janelia.reduce.spec.ImageSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans every frame of a sequence and sorts channel groups into empty, matte, and color override sets.
 *
 * <ul>
 *     <li>
 *         A group is empty when every one of its channels has a maximum of exactly zero in every decoded frame.
 *         Groups whose channel names contain "tonal" (but not "matte") are always empty.
 *     </li>
 *     <li>
 *         A group is matte when a channel name contains "matte" and the group is not empty.
 *     </li>
 *     <li>
 *         A group is color override when a channel name contains "coloroverride" or "colour-override"
 *         and the group is neither empty nor matte.
 *     </li>
 * </ul>
 *
 * Matching is case insensitive.  Frames that cannot be decoded are skipped.
 *
 * @author Eric Trautman
 */
public class ChannelClassifier {

    public static final String MATTE_PATTERN = "matte";
    public static final String TONAL_PATTERN = "tonal";
    public static final List<String> COLOR_OVERRIDE_PATTERNS = List.of("coloroverride", "colour-override");

    private final LayeredImageCodec codec;

    public ChannelClassifier(final LayeredImageCodec codec) {
        this.codec = codec;
    }

    public ChannelClassification classify(final ImageSequence sequence) {
        LOG.info("classify: entry, {}", sequence);
        return classify(sequence.getFrames());
    }

    /**
     * @param  files  ordered files of one layer version.
     *
     * @return classification of the channel groups found in the recognized raster files.
     *         If no file is recognized, the result has no reductions and lists every file for a verbatim copy.
     */
    public ChannelClassification classify(final List<Path> files) {

        final List<Path> frames = files.stream()
                .filter(codec::isSupported)
                .collect(Collectors.toList());

        if (frames.isEmpty()) {
            LOG.info("classify: no raster frames found in {} files, files will be copied as is", files.size());
            return ChannelClassification.forVerbatimCopy(files);
        }

        final Map<String, ChannelStats> channelStats = new LinkedHashMap<>();
        final Set<String> emptyCandidates = new LinkedHashSet<>();
        final Set<String> disqualifiedFromEmpty = new HashSet<>();
        final Set<String> tonalGroups = new LinkedHashSet<>();
        final Set<String> matteCandidates = new LinkedHashSet<>();
        final Set<String> colorOverrideCandidates = new LinkedHashSet<>();

        int undecodableFrameCount = 0;

        for (final Path frame : frames) {

            final LayeredImage image;
            try {
                image = codec.read(frame);
            } catch (final LayeredImageException e) {
                LOG.warn("classify: skipping frame that cannot be decoded, {}", e.getMessage());
                undecodableFrameCount++;
                continue;
            }

            for (final LayeredImageChannel channel : image.getChannels()) {

                final ChannelName name = channel.getName();
                final String base = name.getBase();
                final double frameMax = channel.getMaxValue();

                channelStats.computeIfAbsent(name.getFullName(), k -> new ChannelStats()).addFrame(frameMax);

                if (frameMax != 0) {
                    // once a group shows data it can never become empty again
                    emptyCandidates.remove(base);
                    disqualifiedFromEmpty.add(base);
                } else if (! disqualifiedFromEmpty.contains(base)) {
                    emptyCandidates.add(base);
                }

                if (isColorOverrideName(name)) {
                    colorOverrideCandidates.add(base);
                }

                if (name.containsIgnoreCase(MATTE_PATTERN)) {
                    matteCandidates.add(base);
                } else if (name.containsIgnoreCase(TONAL_PATTERN)) {
                    tonalGroups.add(base);
                }
            }
        }

        // tonal groups are dropped whatever their values are
        final Set<String> empty = new LinkedHashSet<>(emptyCandidates);
        tonalGroups.stream()
                .filter(base -> ! matteCandidates.contains(base))
                .forEach(empty::add);

        final Set<String> matte = new LinkedHashSet<>(matteCandidates);
        matte.removeAll(empty);

        final Set<String> colorOverride = new LinkedHashSet<>(colorOverrideCandidates);
        colorOverride.removeAll(empty);
        colorOverride.removeAll(matte);

        final ChannelClassification classification =
                new ChannelClassification(empty,
                                          matte,
                                          colorOverride,
                                          frames,
                                          true,
                                          channelStats,
                                          undecodableFrameCount);

        LOG.info("classify: exit, analyzed {} of {} frames, result is {}",
                 frames.size() - undecodableFrameCount, frames.size(), classification);

        return classification;
    }

    public static boolean isColorOverrideName(final ChannelName name) {
        for (final String pattern : COLOR_OVERRIDE_PATTERNS) {
            if (name.containsIgnoreCase(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ChannelClassifier.class);
}
