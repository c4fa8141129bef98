package org.janelia.reduce.pipeline;

import java.nio.file.Path;

import org.janelia.reduce.channel.ChannelClassification;

/**
 * Outcome of processing one layer.
 *
 * @author Eric Trautman
 */
public class LayerResult {

    private final String layerName;
    private final LayerState state;
    private final LayerState failedDuring;
    private final Path sourceVersionPath;
    private final Path destinationPath;
    private final String outputPattern;
    private final int writtenFileCount;
    private final ChannelClassification classification;
    private final Throwable failureCause;
    private final long elapsedMilliseconds;

    private LayerResult(final String layerName,
                        final LayerState state,
                        final LayerState failedDuring,
                        final Path sourceVersionPath,
                        final Path destinationPath,
                        final String outputPattern,
                        final int writtenFileCount,
                        final ChannelClassification classification,
                        final Throwable failureCause,
                        final long elapsedMilliseconds) {
        this.layerName = layerName;
        this.state = state;
        this.failedDuring = failedDuring;
        this.sourceVersionPath = sourceVersionPath;
        this.destinationPath = destinationPath;
        this.outputPattern = outputPattern;
        this.writtenFileCount = writtenFileCount;
        this.classification = classification;
        this.failureCause = failureCause;
        this.elapsedMilliseconds = elapsedMilliseconds;
    }

    public static LayerResult done(final String layerName,
                                   final Path sourceVersionPath,
                                   final Path destinationPath,
                                   final String outputPattern,
                                   final int writtenFileCount,
                                   final ChannelClassification classification,
                                   final long elapsedMilliseconds) {
        return new LayerResult(layerName, LayerState.DONE, null, sourceVersionPath, destinationPath, outputPattern,
                               writtenFileCount, classification, null, elapsedMilliseconds);
    }

    public static LayerResult failed(final String layerName,
                                     final LayerState failedDuring,
                                     final Path sourceVersionPath,
                                     final Throwable failureCause,
                                     final long elapsedMilliseconds) {
        return new LayerResult(layerName, LayerState.FAILED, failedDuring, sourceVersionPath, null, null,
                               0, null, failureCause, elapsedMilliseconds);
    }

    public String getLayerName() {
        return layerName;
    }

    public LayerState getState() {
        return state;
    }

    public boolean isDone() {
        return state == LayerState.DONE;
    }

    public boolean isFailed() {
        return state == LayerState.FAILED;
    }

    /**
     * @return the state the unit was in when it failed, or null for completed units.
     */
    public LayerState getFailedDuring() {
        return failedDuring;
    }

    public Path getSourceVersionPath() {
        return sourceVersionPath;
    }

    public Path getDestinationPath() {
        return destinationPath;
    }

    /**
     * @return generic name of the written sequence with frame numbers masked (e.g. beauty_v006.@@@@.tif).
     */
    public String getOutputPattern() {
        return outputPattern;
    }

    public int getWrittenFileCount() {
        return writtenFileCount;
    }

    public ChannelClassification getClassification() {
        return classification;
    }

    public Throwable getFailureCause() {
        return failureCause;
    }

    public String getFailureMessage() {
        String message = null;
        if (failureCause != null) {
            message = failureCause.getMessage() == null ? failureCause.getClass().getSimpleName() :
                      failureCause.getMessage();
        }
        return message;
    }

    public long getElapsedMilliseconds() {
        return elapsedMilliseconds;
    }

    @Override
    public String toString() {
        final String details;
        if (isDone()) {
            details = "wrote " + writtenFileCount + " files to " + destinationPath;
        } else {
            details = "failed during " + failedDuring + ": " + getFailureMessage();
        }
        return "layer '" + layerName + "' " + details;
    }
}
