package org.janelia.reduce.image;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

/**
 * Supported per-channel sample formats.
 *
 * @author Eric Trautman
 */
public enum SampleFormat {

    UINT8(8),
    UINT16(16),
    FLOAT32(32);

    private final int bitDepth;

    SampleFormat(final int bitDepth) {
        this.bitDepth = bitDepth;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public ImageProcessor createProcessor(final int width,
                                          final int height) {
        final ImageProcessor processor;
        switch (this) {
            case UINT8:
                processor = new ByteProcessor(width, height);
                break;
            case UINT16:
                processor = new ShortProcessor(width, height);
                break;
            default:
                processor = new FloatProcessor(width, height);
        }
        return processor;
    }

    public boolean matches(final ImageProcessor processor) {
        return processor.getBitDepth() == bitDepth;
    }

    public static SampleFormat fromBitDepth(final int bitDepth)
            throws IllegalArgumentException {
        for (final SampleFormat format : values()) {
            if (format.bitDepth == bitDepth) {
                return format;
            }
        }
        throw new IllegalArgumentException("unsupported bit depth " + bitDepth);
    }
}
