package org.janelia.reduce.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.janelia.reduce.layout.FolderPreparation;

/**
 * Parameters for staging the output project folder.
 *
 * @author Eric Trautman
 */
public class StagingParameters implements Serializable {

    @Parameter(
            names = "--workspacesRoot",
            description = "Root directory containing per-user workspaces (e.g. /studio/users)",
            required = true)
    public String workspacesRoot;

    @Parameter(
            names = "--userName",
            description = "User whose workspace receives the staged project (default is the current user)")
    public String userName = System.getProperty("user.name");

    @Parameter(
            names = "--deliverableFolder",
            description = "Name of the folder that contains the source, layers, and movie deliverables")
    public String deliverableFolder = FolderPreparation.DEFAULT_DELIVERABLE_FOLDER_NAME;

    /**
     * @return workspace directory for the configured user, with dots in the user name replaced by underscores.
     *
     * @throws IllegalArgumentException
     *   if no user name is available.
     */
    public Path getWorkspaceRoot()
            throws IllegalArgumentException {
        if ((userName == null) || userName.isEmpty()) {
            throw new IllegalArgumentException("a user name must be specified");
        }
        return Paths.get(workspacesRoot, userName.replace('.', '_'));
    }
}
