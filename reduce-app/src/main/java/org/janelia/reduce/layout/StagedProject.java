package org.janelia.reduce.layout;

import java.nio.file.Path;

/**
 * Locations produced by {@link FolderPreparation#stage}.
 *
 * @author Eric Trautman
 */
public class StagedProject {

    private final Path projectFolder;
    private final Path layersFolder;
    private final Path clipsFolder;
    private final Path sourceLayersFolder;
    private final String versionLabel;

    public StagedProject(final Path projectFolder,
                         final Path layersFolder,
                         final Path clipsFolder,
                         final Path sourceLayersFolder,
                         final String versionLabel) {
        this.projectFolder = projectFolder;
        this.layersFolder = layersFolder;
        this.clipsFolder = clipsFolder;
        this.sourceLayersFolder = sourceLayersFolder;
        this.versionLabel = versionLabel;
    }

    /** @return local copy of the versioned project folder. */
    public Path getProjectFolder() {
        return projectFolder;
    }

    /** @return destination for processed layers. */
    public Path getLayersFolder() {
        return layersFolder;
    }

    public Path getClipsFolder() {
        return clipsFolder;
    }

    /** @return read-only source layers folder. */
    public Path getSourceLayersFolder() {
        return sourceLayersFolder;
    }

    public String getVersionLabel() {
        return versionLabel;
    }

    @Override
    public String toString() {
        return "{ \"projectFolder\": \"" + projectFolder +
               "\", \"sourceLayersFolder\": \"" + sourceLayersFolder +
               "\", \"versionLabel\": \"" + versionLabel + "\" }";
    }
}
