package org.janelia.reduce.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for locating the shot, task, and versions to process.
 *
 * @author Eric Trautman
 */
public class CatalogParameters implements Serializable {

    public static final String DEFAULT_TASK_NAME = "TA Layer Export";

    @Parameter(
            names = "--shot",
            description = "Name of the shot to process (e.g. sq010_sh0040)",
            required = true)
    public String shot;

    @Parameter(
            names = "--catalog",
            description = "JSON catalog file listing tasks and versions",
            required = true)
    public String catalog;

    @Parameter(
            names = "--taskName",
            description = "Name of the task whose versions are processed")
    public String taskName = DEFAULT_TASK_NAME;
}
