package org.janelia.reduce.image;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Indicates that a layered image file could not be decoded or encoded.
 *
 * @author Eric Trautman
 */
public class LayeredImageException
        extends IOException {

    private final Path path;

    public LayeredImageException(final Path path,
                                 final String message) {
        super(message + " (" + path + ")");
        this.path = path;
    }

    public LayeredImageException(final Path path,
                                 final String message,
                                 final Throwable cause) {
        super(message + " (" + path + ")", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
