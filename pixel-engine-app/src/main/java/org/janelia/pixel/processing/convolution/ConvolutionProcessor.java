package org.janelia.pixel.processing.convolution;

import java.awt.Rectangle;

import org.janelia.pixel.buffer.PixelBuffer;
import org.janelia.pixel.convolution.ConvolutionPassType;
import org.janelia.pixel.convolution.Convolver;
import org.janelia.pixel.kernel.DenseMatrix;
import org.janelia.pixel.processing.Image;
import org.janelia.pixel.processing.ImageFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a single (non-separable) kernel to each frame in one pass.
 *
 * @author Eric Trautman
 */
public class ConvolutionProcessor
        extends AbstractConvolutionProcessor {

    private final DenseMatrix kernel;

    public ConvolutionProcessor(final Image source,
                                final DenseMatrix kernel)
            throws IllegalArgumentException {
        this(source, source == null ? null : source.getBounds(), kernel);
    }

    public ConvolutionProcessor(final Image source,
                                final Rectangle sourceRectangle,
                                final DenseMatrix kernel)
            throws IllegalArgumentException {
        super(source, sourceRectangle);
        if (kernel == null) {
            throw new IllegalArgumentException("kernel must be specified");
        }
        this.kernel = kernel;
    }

    public DenseMatrix getKernel() {
        return kernel;
    }

    @Override
    protected void onFrameApply(final ImageFrame frame,
                                final Rectangle sourceRectangle) {

        final Rectangle interest = sourceRectangle.intersection(frame.getBounds());
        final PixelBuffer sourcePixels = frame.getPixels();
        final PixelBuffer targetPixels = sourcePixels.createCompatible(sourcePixels.getWidth(),
                                                                       sourcePixels.getHeight());
        sourcePixels.copyPixelsTo(targetPixels);

        LOG.debug("onFrameApply: convolving {} of {} with {}x{} kernel",
                  interest, frame, kernel.getRows(), kernel.getColumns());

        convolveRows(sourcePixels,
                     targetPixels,
                     interest,
                     (source, targetRow, row, column, maxRow, maxColumn, offsetColumn) ->
                             Convolver.convolve(kernel, source, targetRow, row, column,
                                                maxRow, maxColumn, offsetColumn,
                                                ConvolutionPassType.SINGLE));

        targetPixels.copyPixelsTo(sourcePixels);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ConvolutionProcessor.class);
}
