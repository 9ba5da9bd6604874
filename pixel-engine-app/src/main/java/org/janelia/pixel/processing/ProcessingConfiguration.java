package org.janelia.pixel.processing;

import java.io.Reader;
import java.io.Serializable;

import org.janelia.pixel.json.JsonUtils;
import org.janelia.pixel.parallel.ParallelExecutionSettings;

/**
 * Processing options shared by all processors that work on an {@link Image}.
 *
 * @author Eric Trautman
 */
public class ProcessingConfiguration
        implements Serializable {

    private final Integer maxDegreeOfParallelism;
    private final Integer minimumPixelsPerTask;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ProcessingConfiguration() {
        this(null, null);
    }

    /**
     * @param  maxDegreeOfParallelism  maximum number of concurrent row chunks
     *                                 (null for the number of available processors).
     * @param  minimumPixelsPerTask    minimum pixels per row chunk
     *                                 (null for {@link ParallelExecutionSettings#DEFAULT_MINIMUM_PIXELS_PER_TASK}).
     *
     * @throws IllegalArgumentException
     *   if either specified value is not positive.
     */
    public ProcessingConfiguration(final Integer maxDegreeOfParallelism,
                                   final Integer minimumPixelsPerTask)
            throws IllegalArgumentException {
        this.maxDegreeOfParallelism = maxDegreeOfParallelism;
        this.minimumPixelsPerTask = minimumPixelsPerTask;
        validate();
    }

    public int getMaxDegreeOfParallelism() {
        return maxDegreeOfParallelism == null ? Runtime.getRuntime().availableProcessors() : maxDegreeOfParallelism;
    }

    public int getMinimumPixelsPerTask() {
        return minimumPixelsPerTask == null ?
               ParallelExecutionSettings.DEFAULT_MINIMUM_PIXELS_PER_TASK : minimumPixelsPerTask;
    }

    /**
     * @throws IllegalArgumentException
     *   if either configured value is not positive.
     */
    public ParallelExecutionSettings toParallelSettings()
            throws IllegalArgumentException {
        return new ParallelExecutionSettings(getMaxDegreeOfParallelism(), getMinimumPixelsPerTask());
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    /**
     * @throws IllegalArgumentException
     *   if the json cannot be parsed or contains a non-positive value.
     */
    public static ProcessingConfiguration fromJson(final String json)
            throws IllegalArgumentException {
        final ProcessingConfiguration configuration = JSON_HELPER.fromJson(json);
        configuration.validate();
        return configuration;
    }

    public static ProcessingConfiguration fromJson(final Reader json)
            throws IllegalArgumentException {
        final ProcessingConfiguration configuration = JSON_HELPER.fromJson(json);
        configuration.validate();
        return configuration;
    }

    public static ProcessingConfiguration getDefault() {
        return defaultConfiguration;
    }

    /**
     * Replaces the configuration used for images created without an explicit configuration.
     */
    public static void setDefault(final ProcessingConfiguration configuration)
            throws IllegalArgumentException {
        if (configuration == null) {
            throw new IllegalArgumentException("default configuration must be specified");
        }
        defaultConfiguration = configuration;
    }

    private void validate()
            throws IllegalArgumentException {
        if ((maxDegreeOfParallelism != null) && (maxDegreeOfParallelism < 1)) {
            throw new IllegalArgumentException("maxDegreeOfParallelism must be positive but was " +
                                               maxDegreeOfParallelism);
        }
        if ((minimumPixelsPerTask != null) && (minimumPixelsPerTask < 1)) {
            throw new IllegalArgumentException("minimumPixelsPerTask must be positive but was " +
                                               minimumPixelsPerTask);
        }
    }

    private static volatile ProcessingConfiguration defaultConfiguration = new ProcessingConfiguration(null, null);

    private static final JsonUtils.Helper<ProcessingConfiguration> JSON_HELPER =
            new JsonUtils.Helper<>(ProcessingConfiguration.class);
}
