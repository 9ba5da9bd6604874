package org.janelia.pixel.filter;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.pixel.kernel.DenseMatrix;
import org.janelia.pixel.processing.convolution.ConvolutionProcessor;

/**
 * Convolves an image with an arbitrary kernel.
 * The kernel parameter lists the weights row by row, separated by commas.
 *
 * @author Eric Trautman
 */
public class ConvolutionFilter implements Filter {

    private DenseMatrix kernel;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public ConvolutionFilter() {
        this(new DenseMatrix(1, 1, new float[] { 1f }));
    }

    public ConvolutionFilter(final DenseMatrix kernel) {
        this.kernel = kernel;
    }

    public DenseMatrix getKernel() {
        return kernel;
    }

    @Override
    public void init(final Map<String, String> params)
            throws IllegalArgumentException {
        this.kernel = new DenseMatrix(Filter.getIntegerParameter("rows", params),
                                      Filter.getIntegerParameter("columns", params),
                                      Filter.getFloatArrayParameter("kernel", params));
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("rows", String.valueOf(kernel.getRows()));
        map.put("columns", String.valueOf(kernel.getColumns()));
        final StringBuilder weights = new StringBuilder();
        for (final float[] row : kernel.toArray()) {
            for (final float weight : row) {
                if (weights.length() > 0) {
                    weights.append(',');
                }
                weights.append(weight);
            }
        }
        map.put("kernel", weights.toString());
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final double scale) {
        final ColorProcessor cp = ImageProcessorBuffers.toColorProcessor(ip);
        new ConvolutionProcessor(ImageProcessorBuffers.toImage(cp), kernel).apply();
        return cp;
    }
}
