package org.janelia.pixel.buffer;

import org.janelia.pixel.color.ColorVector;

/**
 * Mutable view of one row in a {@link PixelBuffer}.
 * All column accessors are bounds checked.
 *
 * @author Eric Trautman
 */
public interface PixelRow {

    /**
     * @return index of this row within its buffer.
     */
    int getY();

    /**
     * @return number of columns in this row.
     */
    int getWidth();

    /**
     * Converts the sample at column x into the specified colour.
     *
     * @return the specified colour.
     *
     * @throws IndexOutOfBoundsException
     *   if x is outside [0, width).
     */
    ColorVector getColor(final int x,
                         final ColorVector color)
            throws IndexOutOfBoundsException;

    /**
     * Stores the specified colour at column x.
     *
     * @throws IndexOutOfBoundsException
     *   if x is outside [0, width).
     */
    void setColor(final int x,
                  final ColorVector color)
            throws IndexOutOfBoundsException;

    /**
     * Copies length samples starting at sourceX in this row to the target row starting at targetX.
     * Rows with the same sample encoding are copied verbatim,
     * otherwise samples are converted through {@link ColorVector}.
     *
     * @throws IndexOutOfBoundsException
     *   if either range exceeds its row.
     */
    void copyTo(final int sourceX,
                final PixelRow target,
                final int targetX,
                final int length)
            throws IndexOutOfBoundsException;

}
