package org.janelia.pixel.processing;

import java.awt.Rectangle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for processors that modify the frames of their source image in place.
 * Instances are single use: {@link #apply()} may only be called once.
 *
 * @author Eric Trautman
 */
public abstract class FrameProcessor
        extends AbstractPixelProcessor {

    private boolean applied;

    protected FrameProcessor(final Image source,
                             final Rectangle sourceRectangle)
            throws IllegalArgumentException {
        super(source, sourceRectangle);
        this.applied = false;
    }

    /**
     * Processes every frame of the source image.
     *
     * @throws IllegalStateException
     *   if this processor has already been applied.
     */
    public void apply()
            throws IllegalStateException {

        if (applied) {
            throw new IllegalStateException(this + " has already been applied");
        }
        applied = true;

        final Image source = getSource();
        final Rectangle sourceRectangle = getSourceRectangle();

        LOG.debug("apply: entry, processor={}, source={}, sourceRectangle={}", this, source, sourceRectangle);

        for (final ImageFrame frame : source.getFrames()) {
            onFrameApply(frame, sourceRectangle);
        }

        LOG.debug("apply: exit, processor={}", this);
    }

    /**
     * Processes one frame in place.
     *
     * @param  frame            frame to process.
     * @param  sourceRectangle  area of the frame to process.
     */
    protected abstract void onFrameApply(final ImageFrame frame,
                                         final Rectangle sourceRectangle);

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameProcessor.class);
}
