package org.janelia.reduce.util;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    private FileUtil() {
    }

    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        if (file.isDirectory()){
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteSuccessful && deleteRecursive(f);
                }
            }
        }

        if (file.delete()) {
            LOG.debug("deleted " + file.getAbsolutePath());
        } else {
            LOG.warn("failed to delete " + file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    /**
     * Lists the entries of a directory sorted by name.
     *
     * @throws IOException
     *   if the directory cannot be listed.
     */
    public static List<Path> listSorted(final Path directory)
            throws IOException {
        try (final Stream<Path> stream = Files.list(directory)) {
            return stream.sorted().collect(Collectors.toList());
        }
    }

    /**
     * Makes every directory and file under (and including) the specified root writable.
     * Paths that cannot be changed are logged and skipped.
     *
     * @return list of paths that could not be made writable.
     */
    public static List<Path> clearReadOnlyRecursive(final Path root) {

        final List<Path> failedPaths = new ArrayList<>();

        final List<Path> allPaths;
        try (final Stream<Path> stream = Files.walk(root)) {
            allPaths = stream.collect(Collectors.toList());
        } catch (final IOException | RuntimeException e) {
            LOG.warn("clearReadOnlyRecursive: failed to walk {}", root, e);
            failedPaths.add(root);
            return failedPaths;
        }

        for (final Path path : allPaths) {
            final File file = path.toFile();
            boolean cleared;
            try {
                cleared = file.canWrite() || file.setWritable(true);
            } catch (final SecurityException e) {
                cleared = false;
            }
            if (! cleared) {
                LOG.warn("clearReadOnlyRecursive: error removing read-only flag on {}", path);
                failedPaths.add(path);
            }
        }

        LOG.info("clearReadOnlyRecursive: checked {} paths under {}, {} could not be changed",
                 allPaths.size(), root, failedPaths.size());

        return failedPaths;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
