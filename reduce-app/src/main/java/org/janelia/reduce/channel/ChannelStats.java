package org.janelia.reduce.channel;

import java.io.Serializable;

/**
 * Maximum sample value and frame count for one full channel name across a sequence.
 *
 * @author Eric Trautman
 */
public class ChannelStats
        implements Serializable {

    private double maxValue;
    private int frameCount;

    public ChannelStats() {
        this.maxValue = 0;
        this.frameCount = 0;
    }

    public ChannelStats(final double maxValue,
                        final int frameCount) {
        this.maxValue = maxValue;
        this.frameCount = frameCount;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public boolean isAllZero() {
        return maxValue == 0;
    }

    void addFrame(final double frameMaxValue) {
        if ((frameCount == 0) || (frameMaxValue > maxValue)) {
            maxValue = frameMaxValue;
        }
        frameCount++;
    }

    @Override
    public String toString() {
        return "{\"maxValue\": " + maxValue + ", \"frameCount\": " + frameCount + '}';
    }
}
