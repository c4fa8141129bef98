package org.janelia.reduce.layout;

import java.nio.file.Path;

/**
 * Destination directory for one layer's rewritten frames and the version label stamped onto their names.
 *
 * @author Eric Trautman
 */
public class LayerDestination {

    private final Path path;
    private final String versionLabel;

    public LayerDestination(final Path path,
                            final String versionLabel) {
        this.path = path;
        this.versionLabel = versionLabel;
    }

    public Path getPath() {
        return path;
    }

    public String getVersionLabel() {
        return versionLabel;
    }

    @Override
    public String toString() {
        return path + " (" + versionLabel + ")";
    }
}
