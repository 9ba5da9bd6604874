package org.janelia.pixel.buffer;

import org.janelia.pixel.color.ColorVector;
import org.janelia.pixel.color.ColorVectorUtils;

/**
 * Buffer of packed 8-bit per channel ARGB samples stored row by row in an int array
 * (the same layout used by ImageJ's {@link ij.process.ColorProcessor}).
 *
 * @author Eric Trautman
 */
public class ArgbPixelBuffer
        extends AbstractPixelBuffer {

    private final int[] pixels;

    public ArgbPixelBuffer(final int width,
                           final int height) {
        this(width, height, null);
    }

    /**
     * @param  pixels  packed ARGB samples to wrap (not copied) or null to allocate a new blank array.
     *
     * @throws IllegalArgumentException
     *   if the pixel array length does not match the dimensions.
     */
    public ArgbPixelBuffer(final int width,
                           final int height,
                           final int[] pixels)
            throws IllegalArgumentException {
        super(width, height);
        final int pixelCount = getArrayLength(width, height, 1);
        if (pixels == null) {
            this.pixels = new int[pixelCount];
        } else if (pixels.length != pixelCount) {
            throw new IllegalArgumentException("pixel array length " + pixels.length +
                                               " does not match dimensions " + width + "x" + height);
        } else {
            this.pixels = pixels;
        }
    }

    /**
     * @return the backing pixel array.
     */
    public int[] getPixels() {
        return pixels;
    }

    public int get(final int x,
                   final int y) {
        checkRowIndex(y);
        checkColumnIndex(x);
        return pixels[(y * getWidth()) + x];
    }

    public void set(final int x,
                    final int y,
                    final int argb) {
        checkRowIndex(y);
        checkColumnIndex(x);
        pixels[(y * getWidth()) + x] = argb;
    }

    @Override
    public PixelRow getRow(final int y)
            throws IndexOutOfBoundsException {
        return new ArgbRow(y);
    }

    @Override
    public ArgbPixelBuffer createCompatible(final int width,
                                            final int height) {
        return new ArgbPixelBuffer(width, height);
    }

    @Override
    public void copyPixelsTo(final PixelBuffer target)
            throws IllegalArgumentException {
        checkCopyTarget(target);
        System.arraycopy(pixels, 0, ((ArgbPixelBuffer) target).pixels, 0, pixels.length);
    }

    public static int toArgb(final ColorVector color) {
        return (toChannel(color.a) << 24) |
               (toChannel(color.r) << 16) |
               (toChannel(color.g) << 8) |
               toChannel(color.b);
    }

    public static ColorVector toColor(final int argb,
                                      final ColorVector color) {
        return color.set(((argb >> 16) & 0xff) / 255f,
                         ((argb >> 8) & 0xff) / 255f,
                         (argb & 0xff) / 255f,
                         ((argb >>> 24) & 0xff) / 255f);
    }

    private static int toChannel(final float value) {
        return Math.round(ColorVectorUtils.clampUnit(value) * 255f);
    }

    private class ArgbRow
            extends AbstractRow {

        private final int offset;

        ArgbRow(final int y) {
            super(y);
            this.offset = y * getWidth();
        }

        @Override
        public ColorVector getColor(final int x,
                                    final ColorVector color) {
            checkColumnIndex(x);
            return toColor(pixels[offset + x], color);
        }

        @Override
        public void setColor(final int x,
                             final ColorVector color) {
            checkColumnIndex(x);
            pixels[offset + x] = toArgb(color);
        }

        @Override
        public void copyTo(final int sourceX,
                           final PixelRow target,
                           final int targetX,
                           final int length) {
            if (target instanceof ArgbRow) {
                final ArgbRow argbTarget = (ArgbRow) target;
                checkRange(sourceX, length, getWidth());
                checkRange(targetX, length, argbTarget.getWidth());
                System.arraycopy(pixels, offset + sourceX,
                                 argbTarget.getPixels(), argbTarget.offset + targetX,
                                 length);
            } else {
                copyConverted(sourceX, target, targetX, length);
            }
        }

        private int[] getPixels() {
            return pixels;
        }
    }

}
