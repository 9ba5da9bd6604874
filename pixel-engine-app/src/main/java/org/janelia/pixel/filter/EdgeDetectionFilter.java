package org.janelia.pixel.filter;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.pixel.kernel.KernelMatrices.EdgeOperator;
import org.janelia.pixel.processing.convolution.Convolution2DProcessor;

/**
 * Replaces an image with its gradient magnitude using a pair of oriented edge kernels.
 *
 * @author Eric Trautman
 */
public class EdgeDetectionFilter implements Filter {

    private EdgeOperator operator;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public EdgeDetectionFilter() {
        this(EdgeOperator.SOBEL);
    }

    public EdgeDetectionFilter(final EdgeOperator operator) {
        this.operator = operator;
    }

    public EdgeOperator getOperator() {
        return operator;
    }

    @Override
    public void init(final Map<String, String> params)
            throws IllegalArgumentException {
        final String operatorName = Filter.getStringParameter("operator", params);
        try {
            this.operator = EdgeOperator.valueOf(operatorName.trim().toUpperCase());
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown 'operator' value '" + operatorName + "'", e);
        }
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("operator", operator.name());
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final double scale) {
        final ColorProcessor cp = ImageProcessorBuffers.toColorProcessor(ip);
        new Convolution2DProcessor(ImageProcessorBuffers.toImage(cp), operator).apply();
        return cp;
    }
}
