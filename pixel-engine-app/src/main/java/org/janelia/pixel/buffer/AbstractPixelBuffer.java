package org.janelia.pixel.buffer;

import org.janelia.pixel.color.ColorVector;

/**
 * Common dimension handling and bounds checks for {@link PixelBuffer} implementations.
 *
 * @author Eric Trautman
 */
public abstract class AbstractPixelBuffer
        implements PixelBuffer {

    private final int width;
    private final int height;

    protected AbstractPixelBuffer(final int width,
                                  final int height)
            throws IllegalArgumentException {
        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("buffer dimensions must be positive but were " +
                                               width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    /**
     * @return number of array elements needed to store width x height pixels with the specified
     *         number of elements per pixel.
     *
     * @throws IllegalArgumentException
     *   if the count does not fit in a java array.
     */
    protected static int getArrayLength(final int width,
                                        final int height,
                                        final int elementsPerPixel)
            throws IllegalArgumentException {
        final long length = (long) width * height * elementsPerPixel;
        if (length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("buffer dimensions " + width + "x" + height +
                                               " need " + length + " array elements which exceeds " +
                                               Integer.MAX_VALUE);
        }
        return (int) length;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    protected void checkRowIndex(final int y)
            throws IndexOutOfBoundsException {
        if ((y < 0) || (y >= height)) {
            throw new IndexOutOfBoundsException("row " + y + " is outside [0, " + height + ")");
        }
    }

    protected void checkColumnIndex(final int x)
            throws IndexOutOfBoundsException {
        if ((x < 0) || (x >= width)) {
            throw new IndexOutOfBoundsException("column " + x + " is outside [0, " + width + ")");
        }
    }

    protected void checkCopyTarget(final PixelBuffer target)
            throws IllegalArgumentException {
        if (target == null) {
            throw new IllegalArgumentException("copy target must be specified");
        }
        if (! getClass().equals(target.getClass())) {
            throw new IllegalArgumentException("cannot copy " + this + " pixels to " + target);
        }
        if ((width != target.getWidth()) || (height != target.getHeight())) {
            throw new IllegalArgumentException("cannot copy " + this + " pixels to " + target +
                                               " because dimensions differ");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + width + "x" + height + "}";
    }

    /**
     * Base class for row views that handles column bounds checks and conversion based copies.
     */
    protected abstract class AbstractRow
            implements PixelRow {

        private final int y;

        protected AbstractRow(final int y) {
            checkRowIndex(y);
            this.y = y;
        }

        @Override
        public int getY() {
            return y;
        }

        @Override
        public int getWidth() {
            return width;
        }

        protected void checkRange(final int fromX,
                                  final int length,
                                  final int rowWidth)
                throws IndexOutOfBoundsException {
            if ((length < 0) || (fromX < 0) || (fromX + length > rowWidth)) {
                throw new IndexOutOfBoundsException("range [" + fromX + ", " + (fromX + length) +
                                                    ") is outside [0, " + rowWidth + ")");
            }
        }

        protected void copyConverted(final int sourceX,
                                     final PixelRow target,
                                     final int targetX,
                                     final int length) {
            checkRange(sourceX, length, getWidth());
            checkRange(targetX, length, target.getWidth());
            final ColorVector color = new ColorVector();
            for (int i = 0; i < length; i++) {
                target.setColor(targetX + i, getColor(sourceX + i, color));
            }
        }
    }

}
