package org.janelia.reduce.pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts and logs the outcome of a pipeline run.
 *
 * @author Eric Trautman
 */
public class PipelineSummary {

    private final List<LayerResult> doneResults;
    private final List<LayerResult> failedResults;

    public PipelineSummary(final List<LayerResult> results) {
        final Comparator<LayerResult> byName = Comparator.comparing(LayerResult::getLayerName);
        this.doneResults = results.stream().filter(LayerResult::isDone).sorted(byName).collect(Collectors.toList());
        this.failedResults = results.stream().filter(LayerResult::isFailed).sorted(byName).collect(Collectors.toList());
    }

    public List<LayerResult> getDoneResults() {
        return doneResults;
    }

    public List<LayerResult> getFailedResults() {
        return failedResults;
    }

    public List<String> getFailedLayerNames() {
        final List<String> names = new ArrayList<>(failedResults.size());
        failedResults.forEach(r -> names.add(r.getLayerName()));
        return names;
    }

    public boolean hasFailures() {
        return ! failedResults.isEmpty();
    }

    public void log() {
        LOG.info("log: {} layers done, {} layers failed", doneResults.size(), failedResults.size());
        for (final LayerResult result : doneResults) {
            LOG.info("log: done {}, pattern {}", result, result.getOutputPattern());
        }
        for (final LayerResult result : failedResults) {
            LOG.warn("log: FAILED layer '{}' during {}, cause: {}",
                     result.getLayerName(), result.getFailedDuring(), result.getFailureMessage());
        }
    }

    @Override
    public String toString() {
        return doneResults.size() + " layers done, failed layers: " + getFailedLayerNames();
    }

    private static final Logger LOG = LoggerFactory.getLogger(PipelineSummary.class);
}
