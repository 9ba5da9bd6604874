package org.janelia.pixel.processing;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.pixel.buffer.PixelBuffer;

/**
 * One or more equally sized frames with shared image metadata and processing configuration.
 *
 * @author Eric Trautman
 */
public class Image {

    private final ProcessingConfiguration configuration;
    private final Metadata metadata;
    private final List<ImageFrame> frames;

    public Image(final PixelBuffer pixels) {
        this(ProcessingConfiguration.getDefault(),
             new Metadata(),
             Collections.singletonList(new ImageFrame(pixels)));
    }

    /**
     * @throws IllegalArgumentException
     *   if no frames are specified or the frames have different dimensions.
     */
    public Image(final ProcessingConfiguration configuration,
                 final Metadata metadata,
                 final List<ImageFrame> frames)
            throws IllegalArgumentException {

        if ((frames == null) || frames.isEmpty()) {
            throw new IllegalArgumentException("image must have at least one frame");
        }

        final ImageFrame rootFrame = frames.get(0);
        for (final ImageFrame frame : frames) {
            if ((frame.getWidth() != rootFrame.getWidth()) || (frame.getHeight() != rootFrame.getHeight())) {
                throw new IllegalArgumentException("frame " + frame + " does not match root frame " + rootFrame);
            }
        }

        this.configuration = configuration == null ? ProcessingConfiguration.getDefault() : configuration;
        this.metadata = metadata == null ? new Metadata() : metadata;
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
    }

    public ProcessingConfiguration getConfiguration() {
        return configuration;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public List<ImageFrame> getFrames() {
        return frames;
    }

    public ImageFrame getRootFrame() {
        return frames.get(0);
    }

    public int getWidth() {
        return getRootFrame().getWidth();
    }

    public int getHeight() {
        return getRootFrame().getHeight();
    }

    public Rectangle getBounds() {
        return getRootFrame().getBounds();
    }

    @Override
    public String toString() {
        return "Image{" + getWidth() + "x" + getHeight() + ", frameCount=" + frames.size() + '}';
    }
}
