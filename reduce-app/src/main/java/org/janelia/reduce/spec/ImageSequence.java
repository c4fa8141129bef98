package org.janelia.reduce.spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.reduce.util.FileUtil;

/**
 * Ordered, immutable list of frame files for one layer version.
 *
 * @author Eric Trautman
 */
public class ImageSequence {

    private final String layerName;
    private final String versionLabel;
    private final List<Path> frames;

    public ImageSequence(final String layerName,
                         final String versionLabel,
                         final List<Path> frames) {
        this.layerName = layerName;
        this.versionLabel = versionLabel;
        this.frames = Collections.unmodifiableList(frames);
    }

    public String getLayerName() {
        return layerName;
    }

    public String getVersionLabel() {
        return versionLabel;
    }

    public List<Path> getFrames() {
        return frames;
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    @Override
    public String toString() {
        return "sequence for layer '" + layerName + "', version '" + versionLabel + "' with " +
               frames.size() + " files";
    }

    /**
     * Builds a sequence from the regular files in a version directory (e.g. layers/beauty/v002),
     * sorted by file name.
     *
     * @throws IOException
     *   if the directory cannot be listed.
     */
    public static ImageSequence discover(final Path versionDirectory)
            throws IOException {

        if (! Files.isDirectory(versionDirectory)) {
            throw new IOException("version directory " + versionDirectory + " does not exist");
        }

        final Path layerDirectory = versionDirectory.getParent();
        final String layerName = layerDirectory == null ? "" : layerDirectory.getFileName().toString();
        final List<Path> frames = FileUtil.listSorted(versionDirectory).stream()
                .filter(Files::isRegularFile)
                .collect(Collectors.toList());

        return new ImageSequence(layerName, versionDirectory.getFileName().toString(), frames);
    }
}
