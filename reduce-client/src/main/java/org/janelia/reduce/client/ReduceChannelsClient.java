package org.janelia.reduce.client;

import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.reduce.client.asset.JsonVersionRecordSource;
import org.janelia.reduce.client.asset.PublishRequestFileSink;
import org.janelia.reduce.client.asset.PublishSink;
import org.janelia.reduce.client.asset.VersionRecord;
import org.janelia.reduce.client.asset.VersionRecordSource;
import org.janelia.reduce.client.parameter.CatalogParameters;
import org.janelia.reduce.client.parameter.CommandLineParameters;
import org.janelia.reduce.client.parameter.PipelineParameters;
import org.janelia.reduce.client.parameter.StagingParameters;
import org.janelia.reduce.image.ImageJTiffCodec;
import org.janelia.reduce.image.LayeredImageCodec;
import org.janelia.reduce.layout.FolderPreparation;
import org.janelia.reduce.layout.StagedProject;
import org.janelia.reduce.layout.StagingException;
import org.janelia.reduce.pipeline.LayerProcessor;
import org.janelia.reduce.pipeline.LayerResult;
import org.janelia.reduce.pipeline.PipelineOrchestrator;
import org.janelia.reduce.pipeline.PipelineSummary;
import org.janelia.reduce.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client that reduces the channels of every layer of a shot.
 *
 * The client finds the usable (not omitted) versions of the shot's layer export task,
 * stages a new project folder in the user's workspace, rewrites every layer into the staged
 * project, and then requests publication of the staged project.
 * Individual layer failures are logged but do not fail the process.
 *
 * @author Eric Trautman
 */
public class ReduceChannelsClient {

    public static final String PUBLISH_DESCRIPTION = "Publish project folder after reduce channels layers process";

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public CatalogParameters catalog = new CatalogParameters();

        @ParametersDelegate
        public StagingParameters staging = new StagingParameters();

        @ParametersDelegate
        public PipelineParameters pipeline = new PipelineParameters();
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final VersionRecordSource versionRecordSource =
                        new JsonVersionRecordSource(Paths.get(parameters.catalog.catalog));

                final PublishSink publishSink;
                if (parameters.pipeline.skipPublish || (parameters.pipeline.publishQueueDirectory == null)) {
                    publishSink = null;
                } else {
                    publishSink = new PublishRequestFileSink(Paths.get(parameters.pipeline.publishQueueDirectory));
                }

                final ReduceChannelsClient client = new ReduceChannelsClient(parameters,
                                                                             versionRecordSource,
                                                                             new ImageJTiffCodec(),
                                                                             publishSink);
                client.reduceShot();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final VersionRecordSource versionRecordSource;
    private final LayeredImageCodec codec;
    private final PublishSink publishSink;

    public ReduceChannelsClient(final Parameters parameters,
                                final VersionRecordSource versionRecordSource,
                                final LayeredImageCodec codec,
                                final PublishSink publishSink) {
        this.parameters = parameters;
        this.versionRecordSource = versionRecordSource;
        this.codec = codec;
        this.publishSink = publishSink;
    }

    /**
     * Stages, processes, and publishes the configured shot.
     *
     * @return summary of the layer results.
     *
     * @throws ClientRunner.ClientAbortException
     *   if the shot has no usable task or version.
     *
     * @throws StagingException
     *   if the project folder cannot be staged.
     *
     * @throws IOException
     *   if asset queries, layer listing, or publication fail.
     */
    public PipelineSummary reduceShot()
            throws ClientRunner.ClientAbortException, StagingException, IOException {

        final String shot = parameters.catalog.shot;
        final String taskName = parameters.catalog.taskName;

        final Long taskId = versionRecordSource.findTaskId(shot, taskName);
        if (taskId == null) {
            throw new ClientRunner.ClientAbortException("no task '" + taskName + "' found for shot " + shot);
        }

        final List<VersionRecord> usableVersions = versionRecordSource.findVersionsForShotTask(shot, taskName)
                .stream()
                .filter(v -> ! v.isOmitted())
                .collect(Collectors.toList());
        if (usableVersions.isEmpty()) {
            throw new ClientRunner.ClientAbortException("no version that is not omitted found for shot " + shot +
                                                        " and task '" + taskName + "'");
        }

        final VersionRecord latestVersion = usableVersions.get(0);
        if (latestVersion.getPathToMovie() == null) {
            throw new ClientRunner.ClientAbortException("latest " + latestVersion + " has no movie path");
        }

        LOG.info("reduceShot: using latest {} of {} usable versions", latestVersion, usableVersions.size());

        final FolderPreparation folderPreparation = new FolderPreparation(parameters.staging.deliverableFolder);
        final StagedProject stagedProject = folderPreparation.stage(Paths.get(latestVersion.getPathToMovie()),
                                                                    parameters.staging.getWorkspaceRoot());

        final List<String> layerNames = listLayerNames(stagedProject.getSourceLayersFolder());
        final List<String> acceptableVersionCodes = usableVersions.stream()
                .map(VersionRecord::getCode)
                .collect(Collectors.toList());

        final PipelineOrchestrator orchestrator = new PipelineOrchestrator(new LayerProcessor(codec),
                                                                           parameters.pipeline.numberOfThreads);
        final List<LayerResult> results = orchestrator.run(layerNames,
                                                           stagedProject.getSourceLayersFolder(),
                                                           stagedProject.getLayersFolder(),
                                                           acceptableVersionCodes,
                                                           stagedProject.getVersionLabel());

        final PipelineSummary summary = new PipelineSummary(results);
        summary.log();

        if (publishSink == null) {
            LOG.info("reduceShot: skipping publication of {}", stagedProject.getProjectFolder());
        } else {
            publishSink.publish(stagedProject.getProjectFolder(), taskId, PUBLISH_DESCRIPTION);
        }

        return summary;
    }

    /**
     * @return sorted names of the layer directories in the specified source layers folder.
     *
     * @throws IOException
     *   if the folder does not exist or cannot be listed.
     */
    static List<String> listLayerNames(final Path sourceLayersFolder)
            throws IOException {
        if (! Files.isDirectory(sourceLayersFolder)) {
            throw new IOException("source layers folder " + sourceLayersFolder + " does not exist");
        }
        return FileUtil.listSorted(sourceLayersFolder).stream()
                .filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .collect(Collectors.toList());
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReduceChannelsClient.class);
}
