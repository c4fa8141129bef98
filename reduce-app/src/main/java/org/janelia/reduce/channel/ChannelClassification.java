package org.janelia.reduce.channel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of classifying the channels of one image sequence.
 *
 * The empty, matte, and color override sets contain channel group base names and are
 * pairwise disjoint.
 *
 * @author Eric Trautman
 */
public class ChannelClassification {

    private final Set<String> empty;
    private final Set<String> matte;
    private final Set<String> colorOverride;
    private final List<Path> frames;
    private final boolean rasterSequence;
    private final Map<String, ChannelStats> channelStats;
    private final int undecodableFrameCount;

    public ChannelClassification(final Set<String> empty,
                                 final Set<String> matte,
                                 final Set<String> colorOverride,
                                 final List<Path> frames,
                                 final boolean rasterSequence,
                                 final Map<String, ChannelStats> channelStats,
                                 final int undecodableFrameCount)
            throws IllegalArgumentException {

        for (final String base : matte) {
            if (empty.contains(base)) {
                throw new IllegalArgumentException("group '" + base + "' is classified as both empty and matte");
            }
        }
        for (final String base : colorOverride) {
            if (empty.contains(base) || matte.contains(base)) {
                throw new IllegalArgumentException("group '" + base + "' is classified as color override " +
                                                   "and as empty or matte");
            }
        }

        this.empty = Collections.unmodifiableSet(new TreeSet<>(empty));
        this.matte = Collections.unmodifiableSet(new TreeSet<>(matte));
        this.colorOverride = Collections.unmodifiableSet(new TreeSet<>(colorOverride));
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
        this.rasterSequence = rasterSequence;
        this.channelStats = Collections.unmodifiableMap(new LinkedHashMap<>(channelStats));
        this.undecodableFrameCount = undecodableFrameCount;
    }

    /**
     * @return classification for a directory without raster frames, whose files should be copied as is.
     */
    public static ChannelClassification forVerbatimCopy(final List<Path> files) {
        return new ChannelClassification(Collections.emptySet(),
                                         Collections.emptySet(),
                                         Collections.emptySet(),
                                         files,
                                         false,
                                         Collections.emptyMap(),
                                         0);
    }

    public Set<String> getEmpty() {
        return empty;
    }

    public Set<String> getMatte() {
        return matte;
    }

    public Set<String> getColorOverride() {
        return colorOverride;
    }

    /**
     * @return recognized raster frames for a raster sequence, otherwise all files of the sequence.
     */
    public List<Path> getFrames() {
        return frames;
    }

    /**
     * @return false if the sequence contained no recognized raster files.
     */
    public boolean isRasterSequence() {
        return rasterSequence;
    }

    public Map<String, ChannelStats> getChannelStats() {
        return channelStats;
    }

    public int getUndecodableFrameCount() {
        return undecodableFrameCount;
    }

    public boolean hasNoReductions() {
        return empty.isEmpty() && matte.isEmpty() && colorOverride.isEmpty();
    }

    public boolean isEmpty(final String base) {
        return empty.contains(base);
    }

    public boolean isMatte(final String base) {
        return matte.contains(base);
    }

    public boolean isColorOverride(final String base) {
        return colorOverride.contains(base);
    }

    @Override
    public String toString() {
        return "{ \"empty\": " + empty +
               ", \"matte\": " + matte +
               ", \"colorOverride\": " + colorOverride +
               ", \"frameCount\": " + frames.size() +
               ", \"undecodableFrameCount\": " + undecodableFrameCount + " }";
    }
}
