package org.janelia.pixel.parallel;

/**
 * Thrown when parallel pixel processing fails or is interrupted.
 *
 * @author Eric Trautman
 */
public class PixelProcessingException
        extends RuntimeException {

    public PixelProcessingException(final String message,
                                    final Throwable cause) {
        super(message, cause);
    }

}
