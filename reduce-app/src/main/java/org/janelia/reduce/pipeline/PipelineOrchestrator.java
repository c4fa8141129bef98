package org.janelia.reduce.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.reduce.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes the layers of a shot concurrently, one independent unit per layer.
 *
 * A failure in one layer never affects the others: every unit ends with a
 * {@link LayerState#DONE} or {@link LayerState#FAILED} result and {@link #run} returns
 * only after all units have finished.  Results are returned in completion order.
 *
 * @author Eric Trautman
 */
public class PipelineOrchestrator {

    private final LayerProcessor layerProcessor;
    private final int numberOfThreads;

    public PipelineOrchestrator(final LayerProcessor layerProcessor) {
        this(layerProcessor, Runtime.getRuntime().availableProcessors());
    }

    public PipelineOrchestrator(final LayerProcessor layerProcessor,
                                final int numberOfThreads)
            throws IllegalArgumentException {

        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be positive");
        }

        this.layerProcessor = layerProcessor;
        this.numberOfThreads = numberOfThreads;
    }

    public List<LayerResult> run(final List<String> layerNames,
                                 final Path sourceLayersFolder,
                                 final Path destinationLayersFolder,
                                 final List<String> acceptableVersionCodes,
                                 final String versionLabel) {

        LOG.info("run: entry, processing {} layers from {} with {} threads",
                 layerNames.size(), sourceLayersFolder, numberOfThreads);

        if (layerNames.isEmpty()) {
            return Collections.emptyList();
        }

        final ProcessTimer timer = new ProcessTimer();
        final List<String> codes = Collections.unmodifiableList(new ArrayList<>(acceptableVersionCodes));

        final int poolSize = Math.min(numberOfThreads, layerNames.size());
        final ExecutorService executor = (poolSize == 1) ? Executors.newSingleThreadExecutor() :
                                         Executors.newFixedThreadPool(poolSize);
        final CompletionService<LayerResult> completionService = new ExecutorCompletionService<>(executor);

        final Map<Future<LayerResult>, String> layerNameByFuture = new IdentityHashMap<>();
        for (final String layerName : layerNames) {
            final Future<LayerResult> future = completionService.submit(() -> layerProcessor.process(layerName,
                                                                                                      sourceLayersFolder,
                                                                                                      destinationLayersFolder,
                                                                                                      codes,
                                                                                                      versionLabel));
            layerNameByFuture.put(future, layerName);
        }

        final int unitCount = layerNameByFuture.size();
        final List<LayerResult> results = new ArrayList<>(unitCount);
        try {
            for (int i = 0; i < unitCount; i++) {
                final Future<LayerResult> completed = completionService.take();
                results.add(getResult(completed, layerNameByFuture.get(completed)));
                LOG.info("run: {} of {} layers finished", i + 1, unitCount);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for layer units", e);
        } finally {
            executor.shutdown();
        }

        LOG.info("run: exit, processed {} layers in {}", results.size(), timer);

        return results;
    }

    private static LayerResult getResult(final Future<LayerResult> completed,
                                         final String layerName)
            throws InterruptedException {
        try {
            return completed.get();
        } catch (final ExecutionException e) {
            // units convert their own failures, so this only covers errors thrown outside a unit
            LOG.error("run: unexpected failure for layer {}", layerName, e.getCause());
            return LayerResult.failed(layerName, LayerState.PENDING, null, e.getCause(), 0);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PipelineOrchestrator.class);
}
