package org.janelia.reduce.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.janelia.reduce.channel.ChannelClassification;
import org.janelia.reduce.channel.ChannelClassifier;
import org.janelia.reduce.channel.ImageRewriter;
import org.janelia.reduce.image.LayeredImageCodec;
import org.janelia.reduce.layout.LayerDestination;
import org.janelia.reduce.layout.OutputLayoutManager;
import org.janelia.reduce.layout.VersionLocator;
import org.janelia.reduce.spec.ImageSequence;
import org.janelia.reduce.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs resolve, classify, and rewrite steps for a single layer.
 * Instances hold no per-layer state, so one processor can serve many concurrent layer units.
 *
 * @author Eric Trautman
 */
public class LayerProcessor {

    private final VersionLocator versionLocator;
    private final ChannelClassifier classifier;
    private final ImageRewriter rewriter;
    private final OutputLayoutManager layoutManager;

    public LayerProcessor(final LayeredImageCodec codec) {
        this(new VersionLocator(),
             new ChannelClassifier(codec),
             new ImageRewriter(codec),
             new OutputLayoutManager());
    }

    public LayerProcessor(final VersionLocator versionLocator,
                          final ChannelClassifier classifier,
                          final ImageRewriter rewriter,
                          final OutputLayoutManager layoutManager) {
        this.versionLocator = versionLocator;
        this.classifier = classifier;
        this.rewriter = rewriter;
        this.layoutManager = layoutManager;
    }

    /**
     * Processes one layer.  Every exception is converted into a {@link LayerState#FAILED} result.
     */
    public LayerResult process(final String layerName,
                               final Path sourceLayersFolder,
                               final Path destinationLayersFolder,
                               final List<String> acceptableVersionCodes,
                               final String versionLabel) {

        final ProcessTimer timer = new ProcessTimer();

        LayerState state = LayerState.PENDING;
        Path sourceVersionPath = null;

        try {
            state = LayerState.RESOLVING;
            LOG.info("process: analyzing layer {}", layerName);

            final Path layerRoot = sourceLayersFolder.resolve(layerName);
            if (! Files.isDirectory(layerRoot)) {
                throw new LayerResolutionException("layer directory " + layerRoot + " does not exist");
            }

            final Optional<Path> resolvedVersion = versionLocator.resolve(layerRoot, versionLabel, acceptableVersionCodes);
            if (resolvedVersion.isEmpty()) {
                throw new LayerResolutionException("no version that is not omitted found for layer " + layerName);
            }
            sourceVersionPath = resolvedVersion.get();

            state = LayerState.CLASSIFYING;
            final ImageSequence sequence = ImageSequence.discover(sourceVersionPath);
            final ChannelClassification classification = classifier.classify(sequence);

            LOG.info("process: layer {} empty channels: {}", layerName, classification.getEmpty());
            LOG.info("process: layer {} matte overrides: {}", layerName, classification.getMatte());
            LOG.info("process: layer {} color override overrides: {}", layerName, classification.getColorOverride());

            state = LayerState.REWRITING;
            final LayerDestination destination = layoutManager.prepareDestination(sourceVersionPath,
                                                                                   destinationLayersFolder);

            final List<Path> writtenFiles;
            if (classification.isRasterSequence()) {
                writtenFiles = new ArrayList<>(classification.getFrames().size());
                for (final Path frame : classification.getFrames()) {
                    writtenFiles.add(rewriter.rewriteFile(frame,
                                                          destination.getPath(),
                                                          destination.getVersionLabel(),
                                                          classification));
                }
            } else {
                writtenFiles = layoutManager.copyVerbatim(classification.getFrames(), destination);
            }

            final String outputPattern = writtenFiles.isEmpty() ? null :
                                         buildSequencePattern(writtenFiles.get(0).getFileName().toString());

            final LayerResult result = LayerResult.done(layerName,
                                                        sourceVersionPath,
                                                        destination.getPath(),
                                                        outputPattern,
                                                        writtenFiles.size(),
                                                        classification,
                                                        timer.getElapsedMilliseconds());

            LOG.info("process: new version created for {} in {}", result, timer);

            return result;

        } catch (final Throwable t) {
            LOG.error("process: failed to process layer {} during {}", layerName, state, t);
            return LayerResult.failed(layerName, state, sourceVersionPath, t, timer.getElapsedMilliseconds());
        }
    }

    /**
     * @return file name with its frame number replaced by '@' characters
     *         (e.g. beauty_v006.0001.tif becomes beauty_v006.@@@@.tif).
     */
    public static String buildSequencePattern(final String fileName) {
        final Matcher m = FRAME_NUMBER_PATTERN.matcher(fileName);
        if (m.find()) {
            return fileName.substring(0, m.start(1)) + "@".repeat(m.group(1).length()) + fileName.substring(m.end(1));
        }
        return fileName;
    }

    private static final Pattern FRAME_NUMBER_PATTERN = Pattern.compile("\\.(\\d+)\\.[^.]+$");

    private static final Logger LOG = LoggerFactory.getLogger(LayerProcessor.class);
}
