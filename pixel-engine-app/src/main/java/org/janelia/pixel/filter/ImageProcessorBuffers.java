package org.janelia.pixel.filter;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import org.janelia.pixel.buffer.ArgbPixelBuffer;
import org.janelia.pixel.processing.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges ImageJ processors and {@link ArgbPixelBuffer} based images.
 *
 * @author Eric Trautman
 */
public class ImageProcessorBuffers {

    /**
     * @return the specified processor if it is a {@link ColorProcessor},
     *         otherwise an RGB conversion of it.
     */
    public static ColorProcessor toColorProcessor(final ImageProcessor ip) {
        if (ip instanceof ColorProcessor) {
            return (ColorProcessor) ip;
        }
        LOG.debug("toColorProcessor: converting {} to RGB", ip);
        return (ColorProcessor) ip.convertToRGB();
    }

    /**
     * ImageJ ignores the alpha byte of RGB pixels and frequently leaves it zero.
     * If no pixel of the processor has a non-zero alpha byte, every pixel is marked opaque
     * (in place) before it is wrapped.
     *
     * @return buffer that shares the processor's pixel array.
     */
    public static ArgbPixelBuffer wrap(final ColorProcessor cp) {
        final int[] pixels = (int[]) cp.getPixels();
        markOpaqueIfAlphaMissing(pixels);
        return new ArgbPixelBuffer(cp.getWidth(), cp.getHeight(), pixels);
    }

    /**
     * Like {@link #wrap} but the buffer holds a copy of the processor's pixels,
     * so the processor itself is never modified.
     *
     * @return buffer with a private copy of the processor's pixels.
     */
    public static ArgbPixelBuffer copy(final ColorProcessor cp) {
        final int[] pixels = ((int[]) cp.getPixels()).clone();
        markOpaqueIfAlphaMissing(pixels);
        return new ArgbPixelBuffer(cp.getWidth(), cp.getHeight(), pixels);
    }

    /**
     * @return single frame image backed by the processor's pixels.
     */
    public static Image toImage(final ColorProcessor cp) {
        return new Image(wrap(cp));
    }

    /**
     * @return single frame image with a copy of the processor's pixels.
     */
    public static Image toImageCopy(final ColorProcessor cp) {
        return new Image(copy(cp));
    }

    /**
     * @return processor backed by (not copied from) the root frame of the specified image.
     *
     * @throws IllegalArgumentException
     *   if the image is not backed by an {@link ArgbPixelBuffer}.
     */
    public static ColorProcessor toColorProcessor(final Image image)
            throws IllegalArgumentException {
        if (! (image.getRootFrame().getPixels() instanceof ArgbPixelBuffer)) {
            throw new IllegalArgumentException(image + " is not backed by an ARGB buffer");
        }
        final ArgbPixelBuffer buffer = (ArgbPixelBuffer) image.getRootFrame().getPixels();
        return new ColorProcessor(buffer.getWidth(), buffer.getHeight(), buffer.getPixels());
    }

    private static void markOpaqueIfAlphaMissing(final int[] pixels) {
        if (! hasAlpha(pixels)) {
            for (int i = 0; i < pixels.length; i++) {
                pixels[i] |= 0xff000000;
            }
        }
    }

    private static boolean hasAlpha(final int[] pixels) {
        for (final int pixel : pixels) {
            if ((pixel & 0xff000000) != 0) {
                return true;
            }
        }
        return false;
    }

    private ImageProcessorBuffers() {
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageProcessorBuffers.class);
}
