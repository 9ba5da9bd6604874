package org.janelia.pixel.buffer;

import org.janelia.pixel.color.ColorVector;

/**
 * Buffer of 32-bit float red, green, blue, alpha samples.
 * Conversion to and from {@link ColorVector} is lossless and values are not clamped,
 * so this buffer is suitable for intermediate (e.g. premultiplied first pass) results.
 *
 * @author Eric Trautman
 */
public class ColorVectorBuffer
        extends AbstractPixelBuffer {

    private static final int CHANNELS = 4;

    private final float[] samples;

    public ColorVectorBuffer(final int width,
                             final int height) {
        super(width, height);
        this.samples = new float[getArrayLength(width, height, CHANNELS)];
    }

    @Override
    public PixelRow getRow(final int y)
            throws IndexOutOfBoundsException {
        return new VectorRow(y);
    }

    @Override
    public ColorVectorBuffer createCompatible(final int width,
                                              final int height) {
        return new ColorVectorBuffer(width, height);
    }

    @Override
    public void copyPixelsTo(final PixelBuffer target)
            throws IllegalArgumentException {
        checkCopyTarget(target);
        System.arraycopy(samples, 0, ((ColorVectorBuffer) target).samples, 0, samples.length);
    }

    private class VectorRow
            extends AbstractRow {

        private final int offset;

        VectorRow(final int y) {
            super(y);
            this.offset = y * getWidth() * CHANNELS;
        }

        @Override
        public ColorVector getColor(final int x,
                                    final ColorVector color) {
            checkColumnIndex(x);
            final int i = offset + (x * CHANNELS);
            return color.set(samples[i], samples[i + 1], samples[i + 2], samples[i + 3]);
        }

        @Override
        public void setColor(final int x,
                             final ColorVector color) {
            checkColumnIndex(x);
            final int i = offset + (x * CHANNELS);
            samples[i] = color.r;
            samples[i + 1] = color.g;
            samples[i + 2] = color.b;
            samples[i + 3] = color.a;
        }

        @Override
        public void copyTo(final int sourceX,
                           final PixelRow target,
                           final int targetX,
                           final int length) {
            if (target instanceof VectorRow) {
                final VectorRow vectorTarget = (VectorRow) target;
                checkRange(sourceX, length, getWidth());
                checkRange(targetX, length, vectorTarget.getWidth());
                System.arraycopy(samples, offset + (sourceX * CHANNELS),
                                 vectorTarget.getSamples(), vectorTarget.offset + (targetX * CHANNELS),
                                 length * CHANNELS);
            } else {
                copyConverted(sourceX, target, targetX, length);
            }
        }

        private float[] getSamples() {
            return samples;
        }
    }

}
