package org.janelia.reduce.image;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileInfo;
import ij.io.FileOpener;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.io.TiffDecoder;
import ij.io.TiffEncoder;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores layered images as ImageJ TIFF stacks with one slice per channel.
 *
 * Channel names are written as slice labels and, together with the image dimensions and
 * sample format, as a {@link LayeredImageHeader} in the ImageJ info property.
 * A zero-channel image is written as a single blank slice with an empty channel name list.
 *
 * Plain TIFF stacks without a header can be read; their channel names come from slice labels
 * (or <pre> channel[n] </pre> when a slice is unlabeled).
 *
 * @author Eric Trautman
 */
public class ImageJTiffCodec
        implements LayeredImageCodec {

    public static final List<String> SUPPORTED_EXTENSIONS = Arrays.asList("tif", "tiff");

    @Override
    public boolean isSupported(final Path path) {
        final String extension = FilenameUtils.getExtension(path.getFileName().toString());
        return SUPPORTED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    @Override
    public LayeredImage read(final Path path)
            throws LayeredImageException {

        if (! Files.isRegularFile(path)) {
            throw new LayeredImageException(path, "file does not exist");
        }

        final ImagePlus imagePlus;
        try {
            imagePlus = openImagePlus(path);
        } catch (final IOException | RuntimeException e) {
            throw new LayeredImageException(path, "failed to decode image", e);
        }

        if (imagePlus == null) {
            throw new LayeredImageException(path, "failed to decode image");
        }

        final SampleFormat sampleFormat;
        try {
            sampleFormat = SampleFormat.fromBitDepth(imagePlus.getBitDepth());
        } catch (final IllegalArgumentException e) {
            throw new LayeredImageException(path, "unsupported sample format", e);
        }

        final ImageStack stack = imagePlus.getStack();
        final LayeredImageHeader header = LayeredImageHeader.fromJson((String) imagePlus.getProperty(INFO_PROPERTY));

        final List<String> channelNames;
        if ((header != null) && header.isComplete()) {
            channelNames = header.getChannelNames();
            if ((channelNames.size() > 0) && (channelNames.size() != stack.getSize())) {
                throw new LayeredImageException(path, "header lists " + channelNames.size() +
                                                      " channels but file contains " + stack.getSize() + " slices");
            }
        } else {
            channelNames = new ArrayList<>();
            for (int slice = 1; slice <= stack.getSize(); slice++) {
                final String label = stack.getSliceLabel(slice);
                channelNames.add(((label == null) || label.isEmpty()) ? "channel" + (slice - 1) : label);
            }
        }

        final List<LayeredImageChannel> channels = new ArrayList<>(channelNames.size());
        for (int i = 0; i < channelNames.size(); i++) {
            channels.add(new LayeredImageChannel(channelNames.get(i), stack.getProcessor(i + 1)));
        }

        LOG.debug("read: loaded {} channels from {}", channels.size(), path);

        return new LayeredImage(imagePlus.getWidth(), imagePlus.getHeight(), sampleFormat, channels);
    }

    @Override
    public void write(final Path path,
                      final LayeredImage image)
            throws LayeredImageException {

        final ImageStack stack = new ImageStack(image.getWidth(), image.getHeight());
        if (image.getChannelCount() == 0) {
            stack.addSlice("", image.getSampleFormat().createProcessor(image.getWidth(), image.getHeight()));
        } else {
            for (final LayeredImageChannel channel : image.getChannels()) {
                stack.addSlice(channel.getName().getFullName(), channel.getPixels());
            }
        }

        final String headerJson = new LayeredImageHeader(image).toJson();

        final ImagePlus imagePlus = new ImagePlus(path.getFileName().toString(), stack);
        imagePlus.setProperty(INFO_PROPERTY, headerJson);

        final FileInfo fileInfo = imagePlus.getFileInfo();
        fileInfo.info = headerJson;
        fileInfo.sliceLabels = stack.getSliceLabels();
        fileInfo.description = new FileSaver(imagePlus).getDescriptionString();

        try {
            final Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (final OutputStream outputStream = Files.newOutputStream(path)) {
                new TiffEncoder(fileInfo).write(outputStream);
            }
        } catch (final IOException | RuntimeException e) {
            throw new LayeredImageException(path, "failed to write image", e);
        }

        LOG.debug("write: saved {} channels to {}", image.getChannelCount(), path);
    }

    private static ImagePlus openImagePlus(final Path path)
            throws IOException {

        final Path absolutePath = path.toAbsolutePath();
        final String directory = absolutePath.getParent().toString() + File.separator;
        final String name = absolutePath.getFileName().toString();

        final TiffDecoder decoder = new TiffDecoder(directory, name);
        final FileInfo[] info = decoder.getTiffInfo();
        if ((info == null) || (info.length == 0)) {
            throw new IOException("file is not a TIFF");
        }

        final ImagePlus imagePlus;
        if (info.length > 1) {
            imagePlus = new Opener().openTiffStack(info);
        } else {
            imagePlus = new FileOpener(info[0]).openImage();
        }

        if ((imagePlus != null) && (imagePlus.getProperty(INFO_PROPERTY) == null) && (info[0].info != null)) {
            imagePlus.setProperty(INFO_PROPERTY, info[0].info);
        }

        return imagePlus;
    }

    private static final String INFO_PROPERTY = "Info";

    private static final Logger LOG = LoggerFactory.getLogger(ImageJTiffCodec.class);
}
