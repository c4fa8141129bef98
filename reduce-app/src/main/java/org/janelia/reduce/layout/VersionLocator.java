package org.janelia.reduce.layout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.janelia.reduce.spec.VersionLabel;
import org.janelia.reduce.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the version directory to process for a layer.
 *
 * The desired version is used when it exists.  Otherwise, acceptable version codes
 * (e.g. shot010_taLayerExport_v005, already filtered to exclude omitted versions) are checked
 * in order and the first layer version directory whose name appears within a code is used.
 * Without a desired version, the latest version directory is used.
 *
 * @author Eric Trautman
 */
public class VersionLocator {

    /**
     * @param  layerRoot               layer directory containing version directories.
     * @param  desiredVersion          version label to use if present (e.g. v003), or null for the latest.
     * @param  acceptableVersionCodes  ordered codes of versions that may be used instead.
     *
     * @return the version directory to process, or empty if no acceptable version exists.
     *
     * @throws IOException
     *   if the layer directory cannot be listed.
     */
    public Optional<Path> resolve(final Path layerRoot,
                                  final String desiredVersion,
                                  final List<String> acceptableVersionCodes)
            throws IOException {

        if (desiredVersion == null) {
            return VersionLabel.findLatest(layerRoot);
        }

        final Path desiredPath = layerRoot.resolve(desiredVersion);
        if (Files.isDirectory(desiredPath)) {
            return Optional.of(desiredPath);
        }

        LOG.warn("resolve: no version {} found in {}", desiredVersion, layerRoot);

        final List<Path> candidates = FileUtil.listSorted(layerRoot).stream()
                .filter(Files::isDirectory)
                .collect(Collectors.toList());

        for (final String code : acceptableVersionCodes) {
            for (final Path candidate : candidates) {
                if (code.contains(candidate.getFileName().toString())) {
                    LOG.warn("resolve: will use {} instead", candidate);
                    return Optional.of(candidate);
                }
            }
        }

        return Optional.empty();
    }

    private static final Logger LOG = LoggerFactory.getLogger(VersionLocator.class);
}
