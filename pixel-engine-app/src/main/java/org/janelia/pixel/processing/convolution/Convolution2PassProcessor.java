package org.janelia.pixel.processing.convolution;

import java.awt.Rectangle;

import org.janelia.pixel.buffer.ColorVectorBuffer;
import org.janelia.pixel.buffer.PixelBuffer;
import org.janelia.pixel.convolution.ConvolutionPassType;
import org.janelia.pixel.convolution.Convolver;
import org.janelia.pixel.kernel.DenseMatrix;
import org.janelia.pixel.processing.Image;
import org.janelia.pixel.processing.ImageFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a separable kernel to each frame in two passes:
 * the horizontal kernel writes premultiplied results into a float buffer
 * which the vertical kernel then reads verbatim and writes (unpremultiplied) back into the frame.
 *
 * @author Eric Trautman
 */
public class Convolution2PassProcessor
        extends AbstractConvolutionProcessor {

    private final DenseMatrix kernelX;
    private final DenseMatrix kernelY;

    public Convolution2PassProcessor(final Image source,
                                     final DenseMatrix kernelX,
                                     final DenseMatrix kernelY)
            throws IllegalArgumentException {
        this(source, source == null ? null : source.getBounds(), kernelX, kernelY);
    }

    /**
     * @param  kernelX  horizontal (typically one row) kernel.
     * @param  kernelY  vertical (typically one column) kernel.
     */
    public Convolution2PassProcessor(final Image source,
                                     final Rectangle sourceRectangle,
                                     final DenseMatrix kernelX,
                                     final DenseMatrix kernelY)
            throws IllegalArgumentException {
        super(source, sourceRectangle);
        if ((kernelX == null) || (kernelY == null)) {
            throw new IllegalArgumentException("both kernels must be specified");
        }
        this.kernelX = kernelX;
        this.kernelY = kernelY;
    }

    public DenseMatrix getKernelX() {
        return kernelX;
    }

    public DenseMatrix getKernelY() {
        return kernelY;
    }

    @Override
    protected void onFrameApply(final ImageFrame frame,
                                final Rectangle sourceRectangle) {

        final Rectangle interest = sourceRectangle.intersection(frame.getBounds());
        final PixelBuffer framePixels = frame.getPixels();
        final ColorVectorBuffer firstPassPixels = new ColorVectorBuffer(framePixels.getWidth(),
                                                                        framePixels.getHeight());

        // second pass row sampling is clamped to [0, maxRow], so first pass rows above the interest area are needed
        final int firstPassTop = Math.max(0, interest.y - (kernelY.getRows() >> 1));
        final Rectangle firstPassInterest = new Rectangle(interest.x,
                                                          firstPassTop,
                                                          interest.width,
                                                          interest.y + interest.height - firstPassTop);

        LOG.debug("onFrameApply: convolving {} of {} with {}x{} and {}x{} kernels",
                  interest, frame,
                  kernelX.getRows(), kernelX.getColumns(), kernelY.getRows(), kernelY.getColumns());

        convolveRows(framePixels,
                     firstPassPixels,
                     firstPassInterest,
                     (source, targetRow, row, column, maxRow, maxColumn, offsetColumn) ->
                             Convolver.convolve(kernelX, source, targetRow, row, column,
                                                maxRow, maxColumn, offsetColumn,
                                                ConvolutionPassType.FIRST));

        convolveRows(firstPassPixels,
                     framePixels,
                     interest,
                     (source, targetRow, row, column, maxRow, maxColumn, offsetColumn) ->
                             Convolver.convolve(kernelY, source, targetRow, row, column,
                                                maxRow, maxColumn, offsetColumn,
                                                ConvolutionPassType.SECOND));
    }

    private static final Logger LOG = LoggerFactory.getLogger(Convolution2PassProcessor.class);
}
