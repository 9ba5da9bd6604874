package org.janelia.pixel.processing;

import java.awt.Rectangle;

import org.janelia.pixel.parallel.ParallelExecutionSettings;

/**
 * Common state for processors that work on a rectangular area of an {@link Image}.
 *
 * @author Eric Trautman
 */
public abstract class AbstractPixelProcessor {

    private final Image source;
    private final Rectangle sourceRectangle;

    /**
     * @param  source           image to process.
     * @param  sourceRectangle  area of the source to process.
     *
     * @throws IllegalArgumentException
     *   if the rectangle is empty or not fully contained within the source image.
     */
    protected AbstractPixelProcessor(final Image source,
                                     final Rectangle sourceRectangle)
            throws IllegalArgumentException {

        if (source == null) {
            throw new IllegalArgumentException("source image must be specified");
        }
        validateRectangle("source", sourceRectangle, source.getBounds());

        this.source = source;
        this.sourceRectangle = new Rectangle(sourceRectangle);
    }

    public Image getSource() {
        return source;
    }

    public Rectangle getSourceRectangle() {
        return new Rectangle(sourceRectangle);
    }

    public ProcessingConfiguration getConfiguration() {
        return source.getConfiguration();
    }

    public ParallelExecutionSettings getParallelSettings() {
        return getConfiguration().toParallelSettings();
    }

    /**
     * @throws IllegalArgumentException
     *   if the rectangle is null, has a non-positive size, or is not contained in the bounds.
     */
    public static void validateRectangle(final String context,
                                         final Rectangle rectangle,
                                         final Rectangle bounds)
            throws IllegalArgumentException {
        if (rectangle == null) {
            throw new IllegalArgumentException(context + " rectangle must be specified");
        }
        if ((rectangle.width < 1) || (rectangle.height < 1)) {
            throw new IllegalArgumentException(context + " rectangle " + rectangle + " must have a positive size");
        }
        if (! bounds.contains(rectangle)) {
            throw new IllegalArgumentException(context + " rectangle " + rectangle +
                                               " is not contained within " + bounds);
        }
    }

}
