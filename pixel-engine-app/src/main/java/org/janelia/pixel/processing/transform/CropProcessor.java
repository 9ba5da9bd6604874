package org.janelia.pixel.processing.transform;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

import org.janelia.pixel.buffer.PixelBuffer;
import org.janelia.pixel.parallel.ParallelExecutionSettings;
import org.janelia.pixel.parallel.ParallelRowIterator;
import org.janelia.pixel.processing.Image;
import org.janelia.pixel.processing.ImageFrame;
import org.janelia.pixel.processing.TransformProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies a rectangular area of each source frame into a new, smaller image.
 * Pixels are copied verbatim (no resampling).
 *
 * @author Eric Trautman
 */
public class CropProcessor
        extends TransformProcessor {

    // copying is cheap, so each task should process more pixels
    private static final int COPY_PIXELS_PER_TASK_MULTIPLIER = 4;

    private final Rectangle cropRectangle;

    /**
     * @param  source         image to crop.
     * @param  cropRectangle  area to keep (in source coordinates).
     *
     * @throws IllegalArgumentException
     *   if the crop rectangle is empty or not fully contained within the source image.
     */
    public CropProcessor(final Image source,
                         final Rectangle cropRectangle)
            throws IllegalArgumentException {
        this(source, source == null ? null : source.getBounds(), cropRectangle);
    }

    public CropProcessor(final Image source,
                         final Rectangle sourceRectangle,
                         final Rectangle cropRectangle)
            throws IllegalArgumentException {
        super(source, sourceRectangle);
        validateRectangle("crop", cropRectangle, source.getBounds());
        this.cropRectangle = new Rectangle(cropRectangle);
    }

    public Rectangle getCropRectangle() {
        return new Rectangle(cropRectangle);
    }

    @Override
    protected Image createDestination() {
        final Image source = getSource();
        final List<ImageFrame> frames = new ArrayList<>(source.getFrames().size());
        for (final ImageFrame frame : source.getFrames()) {
            frames.add(frame.createCompatible(cropRectangle.width, cropRectangle.height));
        }
        return new Image(source.getConfiguration(), source.getMetadata().deepClone(), frames);
    }

    @Override
    protected void onFrameApply(final ImageFrame source,
                                final ImageFrame destination) {

        final PixelBuffer sourcePixels = source.getPixels();
        final PixelBuffer destinationPixels = destination.getPixels();

        if ((source.getWidth() == destination.getWidth()) &&
            (source.getHeight() == destination.getHeight()) &&
            getSourceRectangle().equals(cropRectangle)) {

            LOG.debug("onFrameApply: copying all pixels of {}", source);

            sourcePixels.copyPixelsTo(destinationPixels);
            return;
        }

        final Rectangle rect = cropRectangle;
        final ParallelExecutionSettings parallelSettings =
                getParallelSettings().multiplyMinimumPixelsPerTask(COPY_PIXELS_PER_TASK_MULTIPLIER);

        LOG.debug("onFrameApply: copying {} of {}", rect, source);

        ParallelRowIterator.iterateRows(
                rect,
                parallelSettings,
                rows -> {
                    for (int y = rows.getMin(); y < rows.getMax(); y++) {
                        sourcePixels.getRow(y).copyTo(rect.x,
                                                      destinationPixels.getRow(y - rect.y),
                                                      0,
                                                      rect.width);
                    }
                });
    }

    @Override
    public String toString() {
        return "CropProcessor{cropRectangle=" + cropRectangle + '}';
    }

    private static final Logger LOG = LoggerFactory.getLogger(CropProcessor.class);
}
