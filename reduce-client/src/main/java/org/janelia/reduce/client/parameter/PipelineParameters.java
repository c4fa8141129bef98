package org.janelia.reduce.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for layer processing and publication.
 *
 * @author Eric Trautman
 */
public class PipelineParameters implements Serializable {

    @Parameter(
            names = "--numberOfThreads",
            description = "Number of layers to process concurrently (default is the number of available processors)")
    public Integer numberOfThreads = Runtime.getRuntime().availableProcessors();

    @Parameter(
            names = "--publishQueueDirectory",
            description = "Directory that receives publish requests for the staged project")
    public String publishQueueDirectory;

    @Parameter(
            names = "--skipPublish",
            description = "Stage and process layers but do not request publication",
            arity = 0)
    public boolean skipPublish = false;
}
