package org.janelia.pixel.parallel;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

/**
 * Immutable tuning parameters for {@link ParallelRowIterator}.
 *
 * @author Eric Trautman
 */
public class ParallelExecutionSettings {

    public static final int DEFAULT_MINIMUM_PIXELS_PER_TASK = 4096;

    private final int maxDegreeOfParallelism;
    private final int minimumPixelsPerTask;
    private final ExecutorService executorService;

    /**
     * Settings using all available processors, {@link #DEFAULT_MINIMUM_PIXELS_PER_TASK}
     * and the common fork join pool.
     */
    public ParallelExecutionSettings() {
        this(Runtime.getRuntime().availableProcessors(), DEFAULT_MINIMUM_PIXELS_PER_TASK);
    }

    public ParallelExecutionSettings(final int maxDegreeOfParallelism,
                                     final int minimumPixelsPerTask)
            throws IllegalArgumentException {
        this(maxDegreeOfParallelism, minimumPixelsPerTask, ForkJoinPool.commonPool());
    }

    /**
     * @param  maxDegreeOfParallelism  maximum number of row chunks processed concurrently.
     * @param  minimumPixelsPerTask    minimum number of pixels a single chunk should cover.
     * @param  executorService         service that runs the chunks.
     *
     * @throws IllegalArgumentException
     *   if either count is not positive or the executor service is null.
     */
    public ParallelExecutionSettings(final int maxDegreeOfParallelism,
                                     final int minimumPixelsPerTask,
                                     final ExecutorService executorService)
            throws IllegalArgumentException {

        if (maxDegreeOfParallelism < 1) {
            throw new IllegalArgumentException("maxDegreeOfParallelism must be positive but was " +
                                               maxDegreeOfParallelism);
        }
        if (minimumPixelsPerTask < 1) {
            throw new IllegalArgumentException("minimumPixelsPerTask must be positive but was " +
                                               minimumPixelsPerTask);
        }
        if (executorService == null) {
            throw new IllegalArgumentException("executorService must be specified");
        }

        this.maxDegreeOfParallelism = maxDegreeOfParallelism;
        this.minimumPixelsPerTask = minimumPixelsPerTask;
        this.executorService = executorService;
    }

    public int getMaxDegreeOfParallelism() {
        return maxDegreeOfParallelism;
    }

    public int getMinimumPixelsPerTask() {
        return minimumPixelsPerTask;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /**
     * @return copy of these settings with the minimum pixels per task multiplied by the specified factor.
     *
     * @throws IllegalArgumentException
     *   if the factor is not positive.
     */
    public ParallelExecutionSettings multiplyMinimumPixelsPerTask(final int multiplier)
            throws IllegalArgumentException {
        if (multiplier < 1) {
            throw new IllegalArgumentException("multiplier must be positive but was " + multiplier);
        }
        final long product = (long) minimumPixelsPerTask * multiplier;
        return new ParallelExecutionSettings(maxDegreeOfParallelism,
                                             (int) Math.min(product, Integer.MAX_VALUE),
                                             executorService);
    }

    @Override
    public String toString() {
        return "{maxDegreeOfParallelism: " + maxDegreeOfParallelism +
               ", minimumPixelsPerTask: " + minimumPixelsPerTask + '}';
    }
}
