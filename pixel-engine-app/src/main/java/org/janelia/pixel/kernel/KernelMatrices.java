package org.janelia.pixel.kernel;

import java.util.Arrays;

/**
 * Factory methods for commonly used convolution kernels.
 *
 * @author Eric Trautman
 */
public class KernelMatrices {

    /**
     * Named pairs of oriented gradient kernels.
     */
    public enum EdgeOperator {

        SOBEL(new float[][] {
                {-1, 0, 1},
                {-2, 0, 2},
                {-1, 0, 1}
        }),

        PREWITT(new float[][] {
                {-1, 0, 1},
                {-1, 0, 1},
                {-1, 0, 1}
        }),

        SCHARR(new float[][] {
                { -3, 0,  3},
                {-10, 0, 10},
                { -3, 0,  3}
        });

        private final DenseMatrix kernelX;
        private final DenseMatrix kernelY;

        EdgeOperator(final float[][] xValues) {
            this.kernelX = new DenseMatrix(xValues);
            this.kernelY = kernelX.transpose();
        }

        public DenseMatrix getKernelX() {
            return kernelX;
        }

        public DenseMatrix getKernelY() {
            return kernelY;
        }
    }

    public static final DenseMatrix LAPLACIAN_3X3 = new DenseMatrix(new float[][] {
            {-1, -1, -1},
            {-1,  8, -1},
            {-1, -1, -1}
    });

    /**
     * @param  size  width and height of the kernel.
     *
     * @return size x size kernel with uniform weights that sum to one.
     *
     * @throws IllegalArgumentException
     *   if size is not positive.
     */
    public static DenseMatrix box(final int size)
            throws IllegalArgumentException {
        if (size < 1) {
            throw new IllegalArgumentException("box size must be positive but was " + size);
        }
        final float[] data = new float[size * size];
        Arrays.fill(data, 1f / data.length);
        return new DenseMatrix(size, size, data);
    }

    /**
     * @param  sigma  standard deviation of the distribution.
     *
     * @return normalized one row gaussian kernel with radius ceil(3 * sigma).
     *
     * @throws IllegalArgumentException
     *   if sigma is not positive.
     */
    public static DenseMatrix gaussianRow(final double sigma)
            throws IllegalArgumentException {

        if (! (sigma > 0)) {
            throw new IllegalArgumentException("sigma must be positive but was " + sigma);
        }

        final int radius = (int) Math.ceil(sigma * 3);
        final int size = (radius * 2) + 1;
        final float[] weights = new float[size];
        final double twoSigmaSquared = 2 * sigma * sigma;

        double sum = 0;
        for (int i = 0; i < size; i++) {
            final int x = i - radius;
            final double weight = Math.exp(-(x * x) / twoSigmaSquared);
            weights[i] = (float) weight;
            sum += weight;
        }

        for (int i = 0; i < size; i++) {
            weights[i] = (float) (weights[i] / sum);
        }

        return new DenseMatrix(1, size, weights);
    }

    /**
     * @return normalized one column gaussian kernel (the transpose of {@link #gaussianRow}).
     */
    public static DenseMatrix gaussianColumn(final double sigma)
            throws IllegalArgumentException {
        return gaussianRow(sigma).transpose();
    }

    private KernelMatrices() {
    }
}
