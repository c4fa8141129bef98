package org.janelia.reduce.layout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.janelia.reduce.spec.VersionLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives and creates destination directories for processed layers.
 *
 * @author Eric Trautman
 */
public class OutputLayoutManager {

    /**
     * Creates (if necessary) the destination directory for the layer that owns the specified version
     * directory.  For example, source <pre> .../layers/beauty/v002 </pre> with destination root
     * <pre> /work/project/layers </pre> maps to <pre> /work/project/layers/beauty </pre> with label v002.
     *
     * @throws IOException
     *   if the source path is too short or the directory cannot be created.
     */
    public LayerDestination prepareDestination(final Path sourceVersionPath,
                                               final Path destinationRoot)
            throws IOException {

        final int nameCount = sourceVersionPath.getNameCount();
        if (nameCount < 2) {
            throw new IOException("source version path " + sourceVersionPath +
                                  " must include a layer and version directory");
        }

        final String layerName = sourceVersionPath.getName(nameCount - 2).toString();
        final String versionLabel = sourceVersionPath.getName(nameCount - 1).toString();

        final Path destinationPath = destinationRoot.resolve(layerName);
        Files.createDirectories(destinationPath);

        return new LayerDestination(destinationPath, versionLabel);
    }

    /**
     * Copies files that are not rewritten, applying the destination's version label to their names.
     *
     * @return paths of the copied files.
     *
     * @throws IOException
     *   if any copy fails.
     */
    public List<Path> copyVerbatim(final List<Path> files,
                                   final LayerDestination destination)
            throws IOException {

        final List<Path> copiedFiles = new ArrayList<>(files.size());
        for (final Path file : files) {
            final Path target = VersionLabel.relabel(file, destination.getPath(), destination.getVersionLabel());
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            if (! target.toFile().setWritable(true)) {
                LOG.warn("copyVerbatim: failed to make {} writable", target);
            }
            copiedFiles.add(target);
        }

        LOG.info("copyVerbatim: copied {} files to {}", copiedFiles.size(), destination);

        return copiedFiles;
    }

    private static final Logger LOG = LoggerFactory.getLogger(OutputLayoutManager.class);
}
