/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.pixel.processing;

import java.awt.Rectangle;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for processors that produce a new image (possibly with a different size)
 * from their source image in two phases:
 * <ol>
 *   <li>{@link #createDestination()} allocates the destination frames, and</li>
 *   <li>{@link #onFrameApply(ImageFrame, ImageFrame)} fills each destination frame
 *       from its corresponding source frame.</li>
 * </ol>
 *
 * The source image is never modified.
 * Instances are single use and neither phase is repeated for a processor.
 *
 * @author Eric Trautman
 */
public abstract class TransformProcessor
        extends AbstractPixelProcessor {

    public enum State {
        CREATED,
        DESTINATION_READY,
        APPLIED,
        FAILED
    }

    private State state;

    protected TransformProcessor(final Image source,
                                 final Rectangle sourceRectangle)
            throws IllegalArgumentException {
        super(source, sourceRectangle);
        this.state = State.CREATED;
    }

    public State getState() {
        return state;
    }

    /**
     * Runs both phases for all source frames.
     *
     * @return the destination image.
     *
     * @throws IllegalStateException
     *   if this processor has already been applied or a previous attempt failed ({@link State#FAILED}),
     *   or if the destination frame count differs from the source frame count.
     */
    public Image apply()
            throws IllegalStateException {

        if (state != State.CREATED) {
            throw new IllegalStateException(this + " cannot be applied because it is in the " + state + " state");
        }

        final Image source = getSource();

        LOG.debug("apply: entry, processor={}, source={}", this, source);

        final Image destination;
        try {
            destination = createDestination();

            final List<ImageFrame> sourceFrames = source.getFrames();
            final List<ImageFrame> destinationFrames = destination.getFrames();
            if (sourceFrames.size() != destinationFrames.size()) {
                throw new IllegalStateException(this + " created " + destinationFrames.size() +
                                                " destination frames for " + sourceFrames.size() + " source frames");
            }

            state = State.DESTINATION_READY;

            for (int i = 0; i < sourceFrames.size(); i++) {
                onFrameApply(sourceFrames.get(i), destinationFrames.get(i));
            }
        } catch (final RuntimeException | Error e) {
            state = State.FAILED;
            throw e;
        }

        state = State.APPLIED;

        LOG.debug("apply: exit, processor={}, destination={}", this, destination);

        return destination;
    }

    /**
     * @return new image with one (blank) frame for each source frame.
     *         Image and frame metadata should be deep copies of the source metadata.
     */
    protected abstract Image createDestination();

    /**
     * Fills the destination frame from the source frame.
     */
    protected abstract void onFrameApply(final ImageFrame source,
                                         final ImageFrame destination);

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private static final Logger LOG = LoggerFactory.getLogger(TransformProcessor.class);
}
