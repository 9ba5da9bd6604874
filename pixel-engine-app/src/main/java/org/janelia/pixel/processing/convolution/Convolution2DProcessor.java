package org.janelia.pixel.processing.convolution;

import java.awt.Rectangle;

import org.janelia.pixel.buffer.PixelBuffer;
import org.janelia.pixel.convolution.Convolver;
import org.janelia.pixel.kernel.DenseMatrix;
import org.janelia.pixel.kernel.KernelMatrices;
import org.janelia.pixel.processing.Image;
import org.janelia.pixel.processing.ImageFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces each pixel with the gradient magnitude derived from two oriented kernels
 * (e.g. Sobel edge detection).  Alpha values are preserved.
 *
 * @author Eric Trautman
 */
public class Convolution2DProcessor
        extends AbstractConvolutionProcessor {

    private final DenseMatrix kernelX;
    private final DenseMatrix kernelY;

    public Convolution2DProcessor(final Image source,
                                  final KernelMatrices.EdgeOperator operator)
            throws IllegalArgumentException {
        this(source,
             source == null ? null : source.getBounds(),
             operator == null ? null : operator.getKernelX(),
             operator == null ? null : operator.getKernelY());
    }

    /**
     * @throws IllegalArgumentException
     *   if either kernel is missing or the kernels have different dimensions.
     */
    public Convolution2DProcessor(final Image source,
                                  final Rectangle sourceRectangle,
                                  final DenseMatrix kernelX,
                                  final DenseMatrix kernelY)
            throws IllegalArgumentException {
        super(source, sourceRectangle);
        if ((kernelX == null) || (kernelY == null)) {
            throw new IllegalArgumentException("both kernels must be specified");
        }
        if ((kernelX.getRows() != kernelY.getRows()) || (kernelX.getColumns() != kernelY.getColumns())) {
            throw new IllegalArgumentException("kernel dimensions differ, kernelX is " +
                                               kernelX.getRows() + "x" + kernelX.getColumns() +
                                               " but kernelY is " +
                                               kernelY.getRows() + "x" + kernelY.getColumns());
        }
        this.kernelX = kernelX;
        this.kernelY = kernelY;
    }

    @Override
    protected void onFrameApply(final ImageFrame frame,
                                final Rectangle sourceRectangle) {

        final Rectangle interest = sourceRectangle.intersection(frame.getBounds());
        final PixelBuffer sourcePixels = frame.getPixels();
        final PixelBuffer targetPixels = sourcePixels.createCompatible(sourcePixels.getWidth(),
                                                                       sourcePixels.getHeight());
        sourcePixels.copyPixelsTo(targetPixels);

        LOG.debug("onFrameApply: computing gradient magnitude for {} of {}", interest, frame);

        convolveRows(sourcePixels,
                     targetPixels,
                     interest,
                     (source, targetRow, row, column, maxRow, maxColumn, offsetColumn) ->
                             Convolver.convolve2D(kernelY, kernelX, source, targetRow, row, column,
                                                  maxRow, maxColumn, offsetColumn));

        targetPixels.copyPixelsTo(sourcePixels);
    }

    private static final Logger LOG = LoggerFactory.getLogger(Convolution2DProcessor.class);
}
