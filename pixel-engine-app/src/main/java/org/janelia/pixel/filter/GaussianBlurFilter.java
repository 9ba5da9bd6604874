package org.janelia.pixel.filter;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.pixel.kernel.KernelMatrices;
import org.janelia.pixel.processing.convolution.Convolution2PassProcessor;

/**
 * Blurs an image with a separable gaussian kernel.
 * The sigma is specified for full scale images and is scaled with the render scale.
 *
 * @author Eric Trautman
 */
public class GaussianBlurFilter implements Filter {

    private double sigma;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public GaussianBlurFilter() {
        this(1.0);
    }

    public GaussianBlurFilter(final double sigma) {
        this.sigma = sigma;
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public void init(final Map<String, String> params)
            throws IllegalArgumentException {
        this.sigma = Filter.getDoubleParameter("sigma", params);
        if (! (sigma > 0)) {
            throw new IllegalArgumentException("sigma must be positive but was " + sigma);
        }
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("sigma", String.valueOf(sigma));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final double scale) {
        final double scaledSigma = sigma * scale;
        final ColorProcessor cp = ImageProcessorBuffers.toColorProcessor(ip);
        new Convolution2PassProcessor(ImageProcessorBuffers.toImage(cp),
                                      KernelMatrices.gaussianRow(scaledSigma),
                                      KernelMatrices.gaussianColumn(scaledSigma)).apply();
        return cp;
    }
}
