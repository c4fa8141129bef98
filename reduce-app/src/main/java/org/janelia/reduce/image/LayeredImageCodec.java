package org.janelia.reduce.image;

import java.nio.file.Path;

/**
 * Reads and writes multi-channel raster files.
 * Implementations must be safe for concurrent use by layer workers.
 *
 * @author Eric Trautman
 */
public interface LayeredImageCodec {

    /**
     * @return true if the specified file has a format this codec can read.
     */
    boolean isSupported(final Path path);

    /**
     * @return header and pixels for every channel in the specified file.
     *
     * @throws LayeredImageException
     *   if the file cannot be opened or decoded.
     */
    LayeredImage read(final Path path)
            throws LayeredImageException;

    /**
     * Writes the specified image, replacing any existing file.
     *
     * @throws LayeredImageException
     *   if the file cannot be written.
     */
    void write(final Path path,
               final LayeredImage image)
            throws LayeredImageException;
}
