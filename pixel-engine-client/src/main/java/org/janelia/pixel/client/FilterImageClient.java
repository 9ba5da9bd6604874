package org.janelia.pixel.client;

import com.beust.jcommander.Parameter;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.janelia.pixel.client.parameter.CommandLineParameters;
import org.janelia.pixel.filter.Filter;
import org.janelia.pixel.filter.FilterSpec;
import org.janelia.pixel.processing.ProcessingConfiguration;
import org.janelia.pixel.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for applying a filter specification to an image file.
 *
 * @author Eric Trautman
 */
public class FilterImageClient {

    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tif";
    public static final String JPEG_FORMAT = "jpeg";

    private static final List<String> SUPPORTED_FORMATS =
            Arrays.asList(PNG_FORMAT, TIFF_FORMAT, "tiff", JPEG_FORMAT, "jpg");

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--in",
                description = "Path of the image to filter",
                required = true)
        public String in;

        @Parameter(
                names = "--out",
                description = "Path for the filtered image",
                required = true)
        public String out;

        @Parameter(
                names = "--filterSpec",
                description = "Path of JSON filter specification file",
                required = true)
        public String filterSpec;

        @Parameter(
                names = "--format",
                description = "Format for output image (png, tif or jpeg)")
        public String format = PNG_FORMAT;

        @Parameter(
                names = "--scale",
                description = "Render scale passed to the filter")
        public Double scale = 1.0;

        @Parameter(
                names = "--numberOfThreads",
                description = "Maximum number of row chunks to process concurrently (default is number of processors)")
        public Integer numberOfThreads;

        @Parameter(
                names = "--minimumPixelsPerTask",
                description = "Minimum number of pixels each parallel task should process")
        public Integer minimumPixelsPerTask;

        @Override
        protected void validate() throws IllegalArgumentException {
            if (! SUPPORTED_FORMATS.contains(format.toLowerCase())) {
                throw new IllegalArgumentException("--format must be one of " + SUPPORTED_FORMATS +
                                                   " but was '" + format + "'");
            }
            if (! (scale > 0)) {
                throw new IllegalArgumentException("--scale must be positive but was " + scale);
            }
            if ((numberOfThreads != null) && (numberOfThreads < 1)) {
                throw new IllegalArgumentException("--numberOfThreads must be positive but was " + numberOfThreads);
            }
            if ((minimumPixelsPerTask != null) && (minimumPixelsPerTask < 1)) {
                throw new IllegalArgumentException("--minimumPixelsPerTask must be positive but was " +
                                                   minimumPixelsPerTask);
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final FilterImageClient client = new FilterImageClient(parameters);
                client.filterFile();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public FilterImageClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Loads the input image and filter specification, filters the image and saves the result.
     *
     * @throws IOException
     *   if any file cannot be read or written.
     */
    public void filterFile()
            throws IOException {

        if ((parameters.numberOfThreads != null) || (parameters.minimumPixelsPerTask != null)) {
            ProcessingConfiguration.setDefault(new ProcessingConfiguration(parameters.numberOfThreads,
                                                                           parameters.minimumPixelsPerTask));
        }

        final FilterSpec filterSpec = loadFilterSpec(new File(parameters.filterSpec));
        final Filter filter = filterSpec.buildInstance();

        final ImagePlus imagePlus = new Opener().openImage(parameters.in);
        if (imagePlus == null) {
            throw new IOException("failed to open image " + parameters.in);
        }

        final ImageProcessor result = filterImage(imagePlus.getProcessor(), filter, parameters.scale);

        saveImage(new ImagePlus(imagePlus.getTitle(), result), parameters.out, parameters.format);
    }

    /**
     * @return result of applying the filter to the specified processor.
     */
    public static ImageProcessor filterImage(final ImageProcessor ip,
                                             final Filter filter,
                                             final double scale) {

        LOG.info("filterImage: entry, processing {}x{} image with {}",
                 ip.getWidth(), ip.getHeight(), FilterSpec.forFilter(filter).getClassName());

        final ProcessTimer timer = new ProcessTimer();
        final ImageProcessor result = filter.process(ip, scale);

        LOG.info("filterImage: exit, produced {}x{} image in {}",
                 result.getWidth(), result.getHeight(), timer);

        return result;
    }

    /**
     * @throws IOException
     *   if the file cannot be read.
     *
     * @throws IllegalArgumentException
     *   if the file does not contain a valid specification.
     */
    public static FilterSpec loadFilterSpec(final File file)
            throws IOException, IllegalArgumentException {
        try (final Reader reader = Files.newBufferedReader(file.toPath())) {
            return FilterSpec.fromJson(reader);
        }
    }

    /**
     * @throws IllegalArgumentException
     *   if the format is not supported.
     *
     * @throws IOException
     *   if the image cannot be written.
     */
    public static void saveImage(final ImagePlus imagePlus,
                                 final String path,
                                 final String format)
            throws IllegalArgumentException, IOException {

        final FileSaver fileSaver = new FileSaver(imagePlus);
        final String lowerCaseFormat = format == null ? PNG_FORMAT : format.toLowerCase();
        final boolean saved;
        switch (lowerCaseFormat) {
            case PNG_FORMAT:
                saved = fileSaver.saveAsPng(path);
                break;
            case TIFF_FORMAT:
            case "tiff":
                saved = fileSaver.saveAsTiff(path);
                break;
            case JPEG_FORMAT:
            case "jpg":
                saved = fileSaver.saveAsJpeg(path);
                break;
            default:
                throw new IllegalArgumentException("unsupported output format '" + format + "'");
        }

        if (! saved) {
            throw new IOException("failed to save " + path);
        }

        LOG.info("saveImage: wrote {}", path);
    }

    private static final Logger LOG = LoggerFactory.getLogger(FilterImageClient.class);
}
