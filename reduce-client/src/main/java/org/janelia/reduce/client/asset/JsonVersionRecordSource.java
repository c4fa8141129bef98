package org.janelia.reduce.client.asset;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VersionRecordSource} backed by a JSON {@link VersionCatalog} file.
 * The file is read for every query, so changes are visible without a restart.
 *
 * @author Eric Trautman
 */
public class JsonVersionRecordSource
        implements VersionRecordSource {

    private final Path catalogPath;

    public JsonVersionRecordSource(final Path catalogPath) {
        this.catalogPath = catalogPath;
    }

    @Override
    public Long findTaskId(final String shotName,
                           final String taskName)
            throws IOException {
        return loadCatalog().getTasks().stream()
                .filter(task -> task.matches(shotName, taskName))
                .map(TaskRecord::getId)
                .findFirst()
                .orElse(null);
    }

    @Override
    public List<VersionRecord> findVersionsForShotTask(final String shotName,
                                                       final String taskName)
            throws IOException {

        final Comparator<VersionRecord> newestFirst =
                Comparator.comparing(VersionRecord::getCreateTimestamp,
                                     Comparator.nullsLast(Comparator.<Date>reverseOrder()));

        final List<VersionRecord> versions = loadCatalog().getVersions().stream()
                .filter(v -> shotName.equals(v.getShotName()) && taskName.equals(v.getTaskName()))
                .sorted(newestFirst)
                .collect(Collectors.toList());

        LOG.info("findVersionsForShotTask: found {} versions for shot {} and task '{}'",
                 versions.size(), shotName, taskName);

        return versions;
    }

    private VersionCatalog loadCatalog()
            throws IOException {
        try (final Reader reader = Files.newBufferedReader(catalogPath, StandardCharsets.UTF_8)) {
            return VersionCatalog.JSON_HELPER.fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse catalog " + catalogPath, e);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(JsonVersionRecordSource.class);
}
