package org.janelia.pixel.buffer;

/**
 * Rectangular, row addressable store of pixel samples with a fixed width and height.
 *
 * Implementations only need to know how to convert their native sample encoding
 * to and from a {@link org.janelia.pixel.color.ColorVector}; convolution and transform
 * code never depends on the concrete encoding.
 *
 * @author Eric Trautman
 */
public interface PixelBuffer {

    /**
     * @return number of columns in this buffer.
     */
    int getWidth();

    /**
     * @return number of rows in this buffer.
     */
    int getHeight();

    /**
     * @param  y  row index.
     *
     * @return mutable view of the specified row.
     *
     * @throws IndexOutOfBoundsException
     *   if y is outside [0, height).
     */
    PixelRow getRow(final int y)
            throws IndexOutOfBoundsException;

    /**
     * @return a new (blank) buffer with the same sample encoding as this buffer.
     *
     * @throws IllegalArgumentException
     *   if the dimensions are not positive.
     */
    PixelBuffer createCompatible(final int width,
                                 final int height)
            throws IllegalArgumentException;

    /**
     * Copies the entire pixel store of this buffer into the target buffer.
     *
     * @throws IllegalArgumentException
     *   if the target has different dimensions or a different sample encoding.
     */
    void copyPixelsTo(final PixelBuffer target)
            throws IllegalArgumentException;

}
