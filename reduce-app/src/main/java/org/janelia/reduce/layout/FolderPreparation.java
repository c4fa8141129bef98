package org.janelia.reduce.layout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.janelia.reduce.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stages a new project folder in a user workspace before layers are processed.
 *
 * A deliverable path like <pre> /shows/x/shot010/taLayerExport/movies/v004/shot010_v004.mov </pre>
 * identifies the export root (<pre> /shows/x/shot010/taLayerExport </pre>) and version (v004).
 * The project files in <pre> [export root]/source/v004 </pre> are copied into
 * <pre> [workspace]/reduce_channel_tool_folders </pre>, empty layers and clips folders are added to the copied
 * project, the deliverable is copied into clips, and read-only flags are cleared on the copy.
 *
 * @author Eric Trautman
 */
public class FolderPreparation {

    public static final String DEFAULT_DELIVERABLE_FOLDER_NAME = "taLayerExport";
    public static final String STAGING_FOLDER_NAME = "reduce_channel_tool_folders";
    public static final String LAYERS_FOLDER_NAME = "layers";
    public static final String CLIPS_FOLDER_NAME = "clips";
    public static final String SOURCE_FOLDER_NAME = "source";

    private final Pattern deliverablePattern;

    public FolderPreparation() {
        this(DEFAULT_DELIVERABLE_FOLDER_NAME);
    }

    public FolderPreparation(final String deliverableFolderName) {
        // group 1 is the export root, group 2 is the first version folder below it
        this.deliverablePattern = Pattern.compile("^(.*?" + Pattern.quote(deliverableFolderName) +
                                                  ")[/\\\\](?:.*?[/\\\\])?(v\\d+)(?=[/\\\\]|$)");
    }

    /**
     * @param  deliverablePath  path of the latest usable movie deliverable.
     * @param  workspaceRoot    user workspace that receives the staged project.
     *
     * @throws StagingException
     *   if the workspace or source project cannot be found, or if copying fails.
     */
    public StagedProject stage(final Path deliverablePath,
                               final Path workspaceRoot)
            throws StagingException {

        LOG.info("stage: entry, deliverablePath={}, workspaceRoot={}", deliverablePath, workspaceRoot);

        if ((workspaceRoot == null) || (! Files.isDirectory(workspaceRoot))) {
            throw new StagingException("user workspace " + workspaceRoot + " does not exist");
        }

        final Matcher m = deliverablePattern.matcher(deliverablePath.toString());
        if (! m.find()) {
            throw new StagingException("unable to find the deliverable folder and version in " + deliverablePath);
        }

        final Path exportRoot = deliverablePath.getFileSystem().getPath(m.group(1));
        final String versionLabel = m.group(2);

        final Path sourceLayersFolder = exportRoot.resolve(LAYERS_FOLDER_NAME);
        final Path sourceProjectVersion = exportRoot.resolve(SOURCE_FOLDER_NAME).resolve(versionLabel);
        if (! Files.isDirectory(sourceProjectVersion)) {
            throw new StagingException("no source version " + sourceProjectVersion +
                                       " to generate the project folder");
        }

        final Path stagingFolder = workspaceRoot.resolve(STAGING_FOLDER_NAME);
        final Path projectFolder;
        final Path layersFolder;
        final Path clipsFolder;
        try {
            final List<Path> projectEntries = FileUtil.listSorted(sourceProjectVersion);
            if (projectEntries.isEmpty()) {
                throw new StagingException("source version " + sourceProjectVersion + " is empty");
            }

            Files.createDirectories(stagingFolder);
            FileUtils.copyDirectory(sourceProjectVersion.toFile(), stagingFolder.toFile());

            projectFolder = stagingFolder.resolve(projectEntries.get(0).getFileName().toString());

            layersFolder = projectFolder.resolve(LAYERS_FOLDER_NAME);
            clipsFolder = projectFolder.resolve(CLIPS_FOLDER_NAME);
            Files.createDirectories(layersFolder);
            Files.createDirectories(clipsFolder);

            FileUtils.copyFileToDirectory(deliverablePath.toFile(), clipsFolder.toFile(), true);

        } catch (final IOException e) {
            throw new StagingException("failed to stage project from " + sourceProjectVersion, e);
        }

        FileUtil.clearReadOnlyRecursive(projectFolder);

        final StagedProject stagedProject =
                new StagedProject(projectFolder, layersFolder, clipsFolder, sourceLayersFolder, versionLabel);

        LOG.info("stage: exit, staged {}", stagedProject);

        return stagedProject;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FolderPreparation.class);
}
