package org.janelia.pixel.processing;

import java.awt.Rectangle;

import org.janelia.pixel.buffer.PixelBuffer;

/**
 * One frame of an {@link Image}: a pixel buffer plus frame specific metadata.
 *
 * @author Eric Trautman
 */
public class ImageFrame {

    private final PixelBuffer pixels;
    private final Metadata metadata;

    public ImageFrame(final PixelBuffer pixels) {
        this(pixels, new Metadata());
    }

    public ImageFrame(final PixelBuffer pixels,
                      final Metadata metadata)
            throws IllegalArgumentException {
        if (pixels == null) {
            throw new IllegalArgumentException("frame pixels must be specified");
        }
        this.pixels = pixels;
        this.metadata = metadata == null ? new Metadata() : metadata;
    }

    public PixelBuffer getPixels() {
        return pixels;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public int getWidth() {
        return pixels.getWidth();
    }

    public int getHeight() {
        return pixels.getHeight();
    }

    public Rectangle getBounds() {
        return new Rectangle(0, 0, getWidth(), getHeight());
    }

    /**
     * @return new frame with a blank buffer of the specified size (same sample encoding as this frame)
     *         and a deep copy of this frame's metadata.
     */
    public ImageFrame createCompatible(final int width,
                                       final int height) {
        return new ImageFrame(pixels.createCompatible(width, height), metadata.deepClone());
    }

    @Override
    public String toString() {
        return "ImageFrame{" + pixels + '}';
    }
}
