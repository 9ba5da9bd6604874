package org.janelia.pixel.processing.convolution;

import java.awt.Rectangle;

import org.janelia.pixel.buffer.ColorVectorBuffer;
import org.janelia.pixel.buffer.PixelBuffer;
import org.janelia.pixel.buffer.PixelRow;
import org.janelia.pixel.parallel.ParallelRowIterator;
import org.janelia.pixel.processing.FrameProcessor;
import org.janelia.pixel.processing.Image;

/**
 * Shared row loop for convolution processors.
 *
 * @author Eric Trautman
 */
public abstract class AbstractConvolutionProcessor
        extends FrameProcessor {

    /**
     * Computes one convolved sample into a working area relative row.
     */
    @FunctionalInterface
    protected interface SampleConvolution {
        void convolve(final PixelBuffer sourcePixels,
                      final PixelRow targetRow,
                      final int row,
                      final int column,
                      final int maxRow,
                      final int maxColumn,
                      final int offsetColumn);
    }

    protected AbstractConvolutionProcessor(final Image source,
                                           final Rectangle sourceRectangle)
            throws IllegalArgumentException {
        super(source, sourceRectangle);
    }

    /**
     * Convolves every pixel of the interest area, reading from sourcePixels and writing to targetPixels.
     * Each target row is loaded into a float row first, so samples keep the alpha currently stored in the target.
     * The two buffers must not be the same instance.
     */
    protected void convolveRows(final PixelBuffer sourcePixels,
                                final PixelBuffer targetPixels,
                                final Rectangle interest,
                                final SampleConvolution sampleConvolution) {

        final int startX = interest.x;
        final int width = interest.width;
        final int maxY = interest.y + interest.height - 1;
        final int maxX = startX + width - 1;

        ParallelRowIterator.iterateRows(
                interest,
                getParallelSettings(),
                rows -> {
                    final PixelRow vectorRow = new ColorVectorBuffer(width, 1).getRow(0);
                    for (int y = rows.getMin(); y < rows.getMax(); y++) {
                        final PixelRow targetRow = targetPixels.getRow(y);
                        targetRow.copyTo(startX, vectorRow, 0, width);
                        for (int x = 0; x < width; x++) {
                            sampleConvolution.convolve(sourcePixels, vectorRow, y, x, maxY, maxX, startX);
                        }
                        vectorRow.copyTo(0, targetRow, startX, width);
                    }
                });
    }

}
