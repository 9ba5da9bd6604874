package org.janelia.pixel.color;

/**
 * Premultiplied alpha helpers for {@link ColorVector} instances.
 * Both operations work in place and leave the alpha component unchanged.
 *
 * @author Eric Trautman
 */
public class ColorVectorUtils {

    /**
     * Alpha values with a magnitude below this threshold are treated as zero by
     * {@link #unPremultiply(ColorVector)}.
     */
    public static final float ALPHA_EPSILON = 1.0e-7f;

    /**
     * Scales the red, green and blue components by alpha.
     */
    public static void premultiply(final ColorVector color) {
        final float alpha = color.a;
        color.r *= alpha;
        color.g *= alpha;
        color.b *= alpha;
    }

    /**
     * Divides the red, green and blue components by alpha.
     * When alpha is (effectively) zero the colour components are left unchanged.
     */
    public static void unPremultiply(final ColorVector color) {
        final float alpha = color.a;
        if (Math.abs(alpha) >= ALPHA_EPSILON) {
            color.r /= alpha;
            color.g /= alpha;
            color.b /= alpha;
        }
    }

    /**
     * @return the specified value clamped to [0, 1].
     */
    public static float clampUnit(final float value) {
        return value < 0f ? 0f : Math.min(value, 1f);
    }

    private ColorVectorUtils() {
    }
}
